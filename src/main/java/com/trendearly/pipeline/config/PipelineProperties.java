package com.trendearly.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Trends 조회 지역 (빈 문자열 = 전세계) */
    private String geo = "";

    private String timeframe = "today 12-m";

    private Duration cacheTtl = Duration.ofDays(7);

    /** null 이면 전체 키워드 처리 */
    private Integer keywordLimit;

    private Trends trends = new Trends();
    private Ingestion ingestion = new Ingestion();
    private Site site = new Site();
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Trends {
        private String baseUrl;
        private Duration minRequestDelay = Duration.ofSeconds(1);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(8);
        private Duration requestTimeout = Duration.ofSeconds(25);
    }

    @Getter
    @Setter
    public static class Ingestion {
        private String baseUrl = "https://ads.tiktok.com";
        private int periodDays = 7;
        private int limitPerList = 100;
    }

    @Getter
    @Setter
    public static class Site {
        private Path liveDir = Path.of("/var/www/trendearly/public");

        /** live-dir 과 같은 파일시스템이어야 rename 이 atomic 하다 */
        private Path stagingDir;

        private String owner;
        private String group;
        private List<String> forbiddenTerms = new ArrayList<>();

        public Path resolveStagingDir() {
            if (stagingDir != null) {
                return stagingDir;
            }
            return liveDir.resolveSibling(liveDir.getFileName() + ".staging");
        }
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
        private String zone = "UTC";
    }
}
