package com.routewise.core.recording;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "routewise.recording")
public class RecordingProperties {

    /** How many issued plans the ledger remembers for correlating reports. */
    private int ledgerCapacity = 10_000;

    /** Upper bound on records the in-memory store keeps; oldest are dropped first. */
    private int inMemoryCapacity = 50_000;

    /** Database for persistent records. Leave the URL empty to keep records in memory. */
    private Jdbc jdbc = new Jdbc();

    public int getLedgerCapacity() { return ledgerCapacity; }
    public void setLedgerCapacity(int ledgerCapacity) { this.ledgerCapacity = ledgerCapacity; }
    public int getInMemoryCapacity() { return inMemoryCapacity; }
    public void setInMemoryCapacity(int inMemoryCapacity) { this.inMemoryCapacity = inMemoryCapacity; }
    public Jdbc getJdbc() { return jdbc; }
    public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }

    public static class Jdbc {
        private String url;
        private String username;
        private String password;
        private int maximumPoolSize = 5;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    }
}
