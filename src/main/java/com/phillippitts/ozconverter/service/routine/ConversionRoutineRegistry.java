package com.phillippitts.ozconverter.service.routine;

import com.phillippitts.ozconverter.exception.UnknownRoutineException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup from routine id to implementation, built once at startup.
 * Only the id crosses the job queue; each worker resolves it here.
 */
public final class ConversionRoutineRegistry {

    private final Map<String, ConversionRoutine> routines;

    public ConversionRoutineRegistry(List<? extends ConversionRoutine> routines) {
        Map<String, ConversionRoutine> byId = new LinkedHashMap<>();
        for (ConversionRoutine routine : routines) {
            ConversionRoutine previous = byId.putIfAbsent(routine.id(), routine);
            if (previous != null) {
                throw new IllegalStateException("Duplicate conversion routine id: " + routine.id());
            }
        }
        this.routines = Collections.unmodifiableMap(byId);
    }

    public Optional<ConversionRoutine> find(String id) {
        return Optional.ofNullable(id == null ? null : routines.get(id));
    }

    /**
     * @throws UnknownRoutineException if no routine has this id
     */
    public ConversionRoutine require(String id) {
        return find(id).orElseThrow(() -> new UnknownRoutineException(id));
    }

    public boolean contains(String id) {
        return id != null && routines.containsKey(id);
    }

    public Collection<String> ids() {
        return routines.keySet();
    }
}
