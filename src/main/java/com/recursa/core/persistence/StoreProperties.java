package com.recursa.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the task state store.
 *
 * <pre>
 * recursa:
 *   store:
 *     type: file            # file | jdbc | memory
 *     directory: ~/.recursa/tasks
 *     jdbc:
 *       url: jdbc:postgresql://localhost:5432/recursa
 *       username: recursa
 *       password: secret
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "recursa.store")
public class StoreProperties {

    private String type = "file";
    private String directory = System.getProperty("user.home") + "/.recursa/tasks";
    private Jdbc jdbc = new Jdbc();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public void setJdbc(Jdbc jdbc) {
        this.jdbc = jdbc;
    }

    public static class Jdbc {
        private String url = "";
        private String username = "";
        private String password = "";
        private int maximumPoolSize = 4;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }
    }
}
