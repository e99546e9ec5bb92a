package com.example.musiccollection;

import com.example.musiccollection.application.job.SyncCommandRunner;
import com.example.musiccollection.common.config.AppCatalogProperties;
import com.example.musiccollection.common.config.AppLibraryProperties;
import com.example.musiccollection.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.musiccollection.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSyncProperties.class,
        AppLibraryProperties.class,
        AppCatalogProperties.class
})
public class MusicCollectionApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(MusicCollectionApplication.class);
        // a one-shot sync from the command line does not start the web server
        if (args.length > 0 && SyncCommandRunner.COMMAND.equalsIgnoreCase(args[0])) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
