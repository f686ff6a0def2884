package guraa.wiringdoc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Pack pack = new Pack();

    public Pack getPack() {
        return pack;
    }

    /**
     * Pack output properties
     */
    public static class Pack {
        private String producer = "wiring-documentation";
        private String timeZone = "UTC";
        private String workingDirectoryPrefix = "doc_pack_";

        public String getProducer() {
            return producer;
        }

        public void setProducer(String producer) {
            this.producer = producer;
        }

        /**
         * Time zone used when the build timestamp is written into document metadata.
         */
        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public String getWorkingDirectoryPrefix() {
            return workingDirectoryPrefix;
        }

        public void setWorkingDirectoryPrefix(String workingDirectoryPrefix) {
            this.workingDirectoryPrefix = workingDirectoryPrefix;
        }
    }
}
