package com.phillippitts.ozconverter.config;

import com.phillippitts.ozconverter.service.process.ToolCommandRunner;
import com.phillippitts.ozconverter.service.routine.ConversionRoutine;
import com.phillippitts.ozconverter.service.routine.ConversionRoutineRegistry;
import com.phillippitts.ozconverter.service.routine.impl.ArchiveExtractRoutine;
import com.phillippitts.ozconverter.service.routine.impl.ArchiveRepackRoutine;
import com.phillippitts.ozconverter.service.routine.impl.ChdmanCompressRoutine;
import com.phillippitts.ozconverter.service.routine.impl.ChdmanExtractRoutine;
import com.phillippitts.ozconverter.service.routine.impl.ChdmanInfoRoutine;
import com.phillippitts.ozconverter.service.routine.impl.ChdmanMediaType;
import com.phillippitts.ozconverter.service.routine.impl.ChdmanVerifyRoutine;
import com.phillippitts.ozconverter.service.routine.impl.DolphinToolRoutine;
import com.phillippitts.ozconverter.service.routine.impl.MaxcsoRoutine;
import com.phillippitts.ozconverter.service.staging.ArchiveStager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the routine registry explicitly so the set of routine ids is fixed and visible in one place.
 */
@Configuration
public class RoutineConfig {

    private static final Logger LOG = LogManager.getLogger(RoutineConfig.class);

    @Bean
    public ConversionRoutineRegistry conversionRoutineRegistry(ToolCommandRunner runner, ArchiveStager archiveStager) {
        ConversionRoutineRegistry registry = new ConversionRoutineRegistry(standardRoutines(runner, archiveStager));
        LOG.info("Registered {} conversion routines", registry.ids().size());
        return registry;
    }

    public static List<ConversionRoutine> standardRoutines(ToolCommandRunner runner, ArchiveStager archiveStager) {
        List<ConversionRoutine> routines = new ArrayList<>();
        for (ChdmanMediaType type : ChdmanMediaType.values()) {
            routines.add(new ChdmanCompressRoutine(type, runner));
            routines.add(new ChdmanExtractRoutine(type, runner));
        }
        routines.add(new ChdmanInfoRoutine(runner));
        routines.add(new ChdmanVerifyRoutine(runner));
        routines.add(DolphinToolRoutine.compressor(runner));
        routines.add(DolphinToolRoutine.extractor(runner));
        routines.add(new MaxcsoRoutine(runner));
        routines.add(new ArchiveExtractRoutine(archiveStager));
        routines.add(new ArchiveRepackRoutine(archiveStager, runner));
        return routines;
    }
}
