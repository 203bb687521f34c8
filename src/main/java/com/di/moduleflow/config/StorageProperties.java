package com.di.moduleflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage selection. {@code memory} (default) keeps targets and the status log in process;
 * {@code jdbc} writes them through a pooled JDBC connection.
 */
@Data
@ConfigurationProperties(prefix = "moduleflow.storage")
public class StorageProperties {

    private String type = "memory";

    private Jdbc jdbc = new Jdbc();

    @Data
    public static class Jdbc {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 4;
    }
}
