package com.casebattle.ledger.config;

import com.casebattle.ledger.eventlog.FileEventLogWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class EventLogConfig {

    @Bean(destroyMethod = "close")
    public FileEventLogWriter fileEventLogWriter(
            @Value("${eventlog.file-path}") String filePath, Clock clock) throws IOException {

        Path logPath = Paths.get(filePath);

        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }

        return new FileEventLogWriter(logPath, clock);
    }
}
