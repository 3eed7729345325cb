package com.example.audiobooksync;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.common.config.AppLibraryProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.audiobooksync.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppImportProperties.class,
        AppLibraryProperties.class
})
public class AudiobookSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudiobookSyncApplication.class, args);
    }
}
