package com.phillippitts.ozconverter;

import com.phillippitts.ozconverter.cli.BatchCommandLineRunner;
import com.phillippitts.ozconverter.config.properties.ConverterProperties;
import com.phillippitts.ozconverter.config.properties.EngineProperties;
import com.phillippitts.ozconverter.config.properties.ToolPathsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties({
        EngineProperties.class,
        ConverterProperties.class,
        ToolPathsConfig.class
})
public class OzConverterApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(OzConverterApplication.class, args);
        // One-shot batch runs exit once the runner returns; otherwise the workers keep the JVM up
        if (context.getBeanNamesForType(BatchCommandLineRunner.class).length > 0) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
