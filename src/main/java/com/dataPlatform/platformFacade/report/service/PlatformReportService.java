package com.dataPlatform.platformFacade.report.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.error.ErrorClassifier;
import com.dataPlatform.platformFacade.platform.PlatformClient;
import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetQuery;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.dataPlatform.platformFacade.platform.model.ModelQuery;
import com.dataPlatform.platformFacade.platform.model.ModelRecord;
import com.dataPlatform.platformFacade.util.PrizeAmounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Builds Markdown reports from live platform data.
 *
 * Reports:
 * - Active competitions (first 20 without a past deadline)
 * - Popular datasets
 * - Upcoming deadlines within 60 days
 * - Platform statistics
 * - Hot topics
 * - Beginner guide
 *
 * A failing report renders as "Error: {message}" instead of throwing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlatformReportService {

    static final int ACTIVE_LIMIT = 20;
    static final int DEADLINE_WINDOW_DAYS = 60;
    static final int NEAR_DEADLINE_DAYS = 30;
    static final int NEAR_DEADLINE_LIMIT = 10;
    static final int URGENT_DAYS = 7;
    static final int TOP_LICENSES = 5;
    static final int TREND_SAMPLE = 20;
    static final int SIZE_SAMPLE = 50;
    static final int SHORT_LIST = 5;
    static final double PRACTICE_USABILITY = 8.0;
    static final long SMALL_DATASET_BYTES = 10L * 1024 * 1024;
    static final long LARGE_DATASET_BYTES = 1024L * 1024 * 1024;
    static final String GETTING_STARTED = "Getting Started";

    private static final DateTimeFormatter DEADLINE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final PlatformClient platformClient;
    private final Clock clock;
    private final FacadeSettings settings;

    public String activeCompetitions() {
        return render("active competitions", () -> {
            Instant now = clock.instant();
            StringBuilder report = new StringBuilder("# Active Competitions\n\n");
            platformClient.listCompetitions().stream()
                    .filter(competition -> competition.getDeadline() == null || competition.getDeadline().isAfter(now))
                    .limit(ACTIVE_LIMIT)
                    .forEach(competition -> report
                            .append("## ").append(competition.getTitle()).append('\n')
                            .append("- **ID**: ").append(competition.getId()).append('\n')
                            .append("- **Category**: ").append(competition.getCategory()).append('\n')
                            .append("- **Reward**: ").append(competition.getReward()).append('\n')
                            .append("- **Deadline**: ").append(competition.getDeadline() != null
                                    ? competition.getDeadline().toString() : "Not specified").append('\n')
                            .append("- **Teams**: ").append(competition.getTotalTeams()).append('\n')
                            .append("- **URL**: ").append(competition.getUrl()).append("\n\n"));
            return report.toString();
        });
    }

    public String popularDatasets() {
        return render("popular datasets", () -> {
            StringBuilder report = new StringBuilder("# Popular Datasets\n\n");
            for (DatasetRecord dataset : platformClient.listDatasets(defaultDatasetQuery())) {
                report.append("## ").append(dataset.getTitle()).append('\n')
                        .append("- **Reference**: ").append(dataset.getRef()).append('\n')
                        .append("- **Size**: ").append(dataset.getSize() != null ? dataset.getSize().display() : "Unknown").append('\n')
                        .append("- **Downloads**: ").append(dataset.getDownloadCount()).append('\n')
                        .append("- **Votes**: ").append(dataset.getVoteCount()).append('\n')
                        .append("- **Usability**: ").append(dataset.getUsabilityRating()).append('\n')
                        .append("- **License**: ").append(dataset.getLicenseName()).append('\n')
                        .append("- **Last Updated**: ").append(dataset.getLastUpdated() != null
                                ? dataset.getLastUpdated().toString() : "Unknown").append('\n')
                        .append("- **URL**: ").append(datasetUrl(dataset)).append("\n\n");
            }
            return report.toString();
        });
    }

    /**
     * Competitions closing within the next 60 days, nearest first.
     */
    public String upcomingDeadlines() {
        return render("upcoming deadlines", () -> {
            Instant now = clock.instant();
            List<UpcomingDeadline> upcoming = platformClient.listCompetitions().stream()
                    .filter(competition -> competition.getDeadline() != null)
                    .map(competition -> new UpcomingDeadline(competition,
                            Duration.between(now, competition.getDeadline()).toDays()))
                    .filter(entry -> !entry.competition().getDeadline().isBefore(now)
                            && entry.daysLeft() <= DEADLINE_WINDOW_DAYS)
                    .sorted(Comparator.comparing(entry -> entry.competition().getDeadline()))
                    .toList();

            StringBuilder report = new StringBuilder("# Upcoming Competition Deadlines\n\n");
            report.append("## Next 30 Days\n\n");
            upcoming.stream()
                    .limit(NEAR_DEADLINE_LIMIT)
                    .filter(entry -> entry.daysLeft() <= NEAR_DEADLINE_DAYS)
                    .forEach(entry -> report
                            .append("- **").append(entry.competition().getTitle()).append("** (")
                            .append(entry.daysLeft() <= URGENT_DAYS ? "URGENT" : "Soon").append(")\n")
                            .append("  - Days left: ").append(entry.daysLeft()).append('\n')
                            .append("  - Reward: ").append(entry.competition().getReward()).append('\n')
                            .append("  - Deadline: ").append(DEADLINE_FORMAT.format(entry.competition().getDeadline()))
                            .append("\n\n"));

            report.append("## This Month\n\n");
            upcoming.stream()
                    .filter(entry -> entry.daysLeft() > NEAR_DEADLINE_DAYS)
                    .forEach(entry -> report
                            .append("- **").append(entry.competition().getTitle()).append("**\n")
                            .append("  - Days left: ").append(entry.daysLeft()).append('\n')
                            .append("  - Reward: ").append(entry.competition().getReward()).append("\n\n"));
            return report.toString();
        });
    }

    public String platformStatistics() {
        return render("platform statistics", () -> {
            List<CompetitionRecord> competitions = platformClient.listCompetitions();
            List<DatasetRecord> datasets = platformClient.listDatasets(defaultDatasetQuery());
            List<ModelRecord> models = platformClient.listModels(ModelQuery.builder().pageSize(20).build());

            Map<String, Long> categories = countBy(competitions.stream()
                    .map(competition -> competition.getCategory() != null ? competition.getCategory() : "Unknown")
                    .toList());
            long prizePool = competitions.stream().mapToLong(competition -> PrizeAmounts.parse(competition.getReward())).sum();
            long highValue = competitions.stream().filter(competition -> PrizeAmounts.parse(competition.getReward()) > 0).count();

            StringBuilder report = new StringBuilder("# Platform Statistics\n\n");
            report.append("## Competition Overview\n\n")
                    .append("- **Total Active Competitions**: ").append(competitions.size()).append('\n')
                    .append("- **Total Prize Pool**: $").append(String.format(Locale.ROOT, "%,d", prizePool)).append('\n')
                    .append("- **Categories**: ").append(categories.size()).append("\n\n");
            categories.forEach((category, count) ->
                    report.append("  - ").append(category).append(": ").append(count).append(" competitions\n"));

            long totalDownloads = datasets.stream()
                    .filter(dataset -> dataset.getDownloadCount() != null)
                    .mapToLong(DatasetRecord::getDownloadCount)
                    .sum();
            OptionalDouble averageUsability = datasets.stream()
                    .filter(dataset -> dataset.getUsabilityRating() != null && dataset.getUsabilityRating() > 0)
                    .mapToDouble(DatasetRecord::getUsabilityRating)
                    .average();

            report.append("\n## Dataset Overview\n\n")
                    .append("- **Total Popular Datasets**: ").append(datasets.size()).append('\n')
                    .append("- **Total Downloads**: ").append(String.format(Locale.ROOT, "%,d", totalDownloads)).append('\n')
                    .append("- **Average Usability Rating**: ").append(averageUsability.isPresent()
                            ? String.format(Locale.ROOT, "%.1f/10", averageUsability.getAsDouble()) : "n/a").append('\n');

            report.append("\n## Model Hub Overview\n\n")
                    .append("- **Total Available Models**: ").append(models.size()).append('\n');

            report.append("\n## License Distribution\n\n");
            countBy(datasets.stream()
                    .map(dataset -> dataset.getLicenseName() != null ? dataset.getLicenseName() : "Unknown")
                    .toList())
                    .entrySet().stream()
                    .limit(TOP_LICENSES)
                    .forEach(entry -> report.append("- **").append(entry.getKey()).append("**: ")
                            .append(entry.getValue()).append(" datasets\n"));

            report.append("\n## Platform Insights\n\n")
                    .append("- **Most Popular Category**: ")
                    .append(categories.isEmpty() ? "n/a" : categories.keySet().iterator().next()).append('\n')
                    .append("- **Average Competitions per Category**: ")
                    .append(categories.isEmpty() ? "n/a"
                            : String.format(Locale.ROOT, "%.1f", (double) competitions.size() / categories.size()))
                    .append('\n')
                    .append("- **High-Value Competitions**: ").append(highValue).append('\n');
            return report.toString();
        });
    }

    /**
     * Trending competition categories, high-value competitions and dataset size mix.
     */
    public String hotTopics() {
        return render("hot topics", () -> {
            List<CompetitionRecord> competitions = platformClient.listCompetitions();
            List<DatasetRecord> datasets = platformClient.listDatasets(defaultDatasetQuery());

            StringBuilder report = new StringBuilder("# Trending Topics & Techniques\n\n");
            report.append("## Hot Competition Categories\n\n");
            countBy(competitions.stream()
                    .limit(TREND_SAMPLE)
                    .map(competition -> competition.getCategory() != null ? competition.getCategory() : "Unknown")
                    .toList())
                    .forEach((category, count) -> report.append("- **").append(category).append("**: ")
                            .append(count).append(" active competitions\n"));

            report.append("\n## High-Value Recent Competitions\n\n");
            competitions.stream()
                    .filter(competition -> competition.getReward() != null && competition.getReward().contains("Usd"))
                    .limit(SHORT_LIST)
                    .forEach(competition -> report.append("- **").append(competition.getTitle()).append("**: ")
                            .append(competition.getReward()).append('\n'));

            Map<String, Long> sizes = new LinkedHashMap<>();
            sizes.put("Small", 0L);
            sizes.put("Medium", 0L);
            sizes.put("Large", 0L);
            datasets.stream()
                    .limit(SIZE_SAMPLE)
                    .filter(dataset -> dataset.getSize() != null)
                    .forEach(dataset -> sizes.merge(sizeClass(dataset.getSize().bytes()), 1L, Long::sum));

            report.append("\n## Trending Dataset Types\n\n");
            sizes.forEach((sizeClass, count) -> report.append("- **").append(sizeClass).append(" Datasets**: ")
                    .append(count).append(" popular entries\n"));

            report.append("\n## Emerging Patterns\n\n")
                    .append("- **AI/ML Focus**: General artificial intelligence challenges gaining traction\n")
                    .append("- **Real-world Impact**: More competitions focusing on social good\n")
                    .append("- **Multi-modal Data**: Increasing use of combined text, image, and sensor data\n")
                    .append("- **Time Series**: Growing interest in forecasting and temporal data\n");
            return report.toString();
        });
    }

    /**
     * Learning path: "Getting Started" competitions and well-rated practice datasets.
     */
    public String beginnerGuide() {
        return render("beginner guide", () -> {
            List<CompetitionRecord> competitions = platformClient.listCompetitions();
            List<DatasetRecord> datasets = platformClient.listDatasets(defaultDatasetQuery());

            StringBuilder report = new StringBuilder("# Getting Started Guide\n\n");
            report.append("## Recommended Learning Path\n\n")
                    .append("### Step 1: Start with These Competitions\n");
            competitions.stream()
                    .filter(competition -> competition.getCategory() != null
                            && competition.getCategory().contains(GETTING_STARTED))
                    .limit(SHORT_LIST)
                    .forEach(competition -> report
                            .append("- **").append(competition.getTitle()).append("**\n")
                            .append("  - Category: ").append(competition.getCategory()).append('\n')
                            .append("  - Reward: ").append(competition.getReward()).append('\n')
                            .append("  - URL: ").append(competition.getUrl()).append("\n\n"));

            report.append("### Step 2: Practice Datasets\n");
            datasets.stream()
                    .limit(TREND_SAMPLE)
                    .filter(dataset -> dataset.getUsabilityRating() != null
                            && dataset.getUsabilityRating() >= PRACTICE_USABILITY)
                    .limit(SHORT_LIST)
                    .forEach(dataset -> report
                            .append("- **").append(dataset.getTitle()).append("**\n")
                            .append("  - Reference: ").append(dataset.getRef()).append('\n')
                            .append("  - Size: ").append(dataset.getSize() != null ? dataset.getSize().display() : "Unknown")
                            .append('\n')
                            .append("  - Usability: ").append(dataset.getUsabilityRating()).append("/10\n\n"));

            report.append("## Learning Recommendations\n\n")
                    .append("### Beginner Track\n")
                    .append("1. **Titanic**: Classification basics\n")
                    .append("2. **House Prices**: Regression techniques\n")
                    .append("3. **Digit Recognizer**: Computer vision intro\n")
                    .append("4. **NLP Disaster Tweets**: Natural language processing\n\n")
                    .append("### Intermediate Track\n")
                    .append("1. **Store Sales Forecasting**: Time series analysis\n")
                    .append("2. **Spaceship Titanic**: Feature engineering\n")
                    .append("3. **Connect X**: Reinforcement learning\n\n");

            report.append("## Pro Tips\n\n")
                    .append("- Start with 'Getting Started' competitions for learning\n")
                    .append("- Read winning solutions and public notebooks\n")
                    .append("- Join Kaggle Learn for structured courses\n")
                    .append("- Participate in discussions to learn from community\n")
                    .append("- Focus on understanding data before complex models\n");
            return report.toString();
        });
    }

    static String sizeClass(long bytes) {
        if (bytes < SMALL_DATASET_BYTES) {
            return "Small";
        }
        return bytes < LARGE_DATASET_BYTES ? "Medium" : "Large";
    }

    /**
     * Occurrence counts ordered by count descending, ties in first-seen order.
     */
    static Map<String, Long> countBy(List<String> values) {
        Map<String, Long> counts = new LinkedHashMap<>();
        values.forEach(value -> counts.merge(value, 1L, Long::sum));
        Map<String, Long> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    private static DatasetQuery defaultDatasetQuery() {
        return DatasetQuery.builder().sortBy("hottest").page(1).pageSize(20).build();
    }

    private String datasetUrl(DatasetRecord dataset) {
        return settings.getSiteUrl() + "/datasets/" + dataset.getRef();
    }

    private String render(String reportName, Supplier<String> builder) {
        try {
            return builder.get();
        } catch (RuntimeException e) {
            log.error("Report failed - report: {}, error: {}", reportName, ErrorClassifier.describe(e));
            return "Error: " + ErrorClassifier.describe(e);
        }
    }

    private record UpcomingDeadline(CompetitionRecord competition, long daysLeft) {
    }
}
