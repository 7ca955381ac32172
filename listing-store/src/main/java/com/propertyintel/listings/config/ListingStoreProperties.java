package com.propertyintel.listings.config;

import com.propertyintel.listings.model.Category;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "listing-store")
@Data
public class ListingStoreProperties {

    private Schema schema = new Schema();
    private Recrawl recrawl = new Recrawl();
    private Migration migration = new Migration();
    private Export export = new Export();
    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Schema {
        /** Create live tables on startup when they are missing */
        private boolean autoCreate = true;
    }

    @Data
    public static class Recrawl {
        private PolicyMode policy = PolicyMode.FIXED;
        private Duration rentInterval = Duration.ofDays(3);
        private Duration buyInterval = Duration.ofDays(7);

        /** Upper bound for BACKOFF mode */
        private Duration maxInterval = Duration.ofDays(30);

        /** Rows fetched per round trip when iterating the due queue */
        private int pageSize = 500;

        /** Statuses meaning the listing left the market (case-insensitive, substring match) */
        private List<String> inactiveStatuses = new ArrayList<>(List.of(
                "sold", "rented", "withdrawn", "removed",
                "verkocht", "verhuurd", "ingetrokken"));

        /** Sale or let agreed under conditions; still crawled even when an inactive status also matches */
        private List<String> conditionalStatuses = new ArrayList<>(List.of(
                "onder voorbehoud", "subject to contract"));

        public Duration intervalFor(Category category) {
            return category == Category.RENT ? rentInterval : buyInterval;
        }

        public enum PolicyMode {
            FIXED, BACKOFF
        }
    }

    @Data
    public static class Migration {
        /** Put live listings into the staging recrawl queue during backfill */
        private boolean seedRecrawlQueue = true;
        private boolean runBackfillOnStartup = false;

        /** Legacy properties read per query during backfill */
        private int readPageSize = 500;
        private List<Category> categories = new ArrayList<>(List.of(Category.RENT, Category.BUY));
    }

    @Data
    public static class Export {
        private String outputDir = "/data/output";
        private boolean includeHeader = true;
    }

    @Data
    public static class Maintenance {
        private String cron = "0 */15 * * * *";
    }
}
