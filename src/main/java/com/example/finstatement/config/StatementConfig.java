package com.example.finstatement.config;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.example.finstatement.augment.AugmentationAdapter;
import com.example.finstatement.augment.NoOpAugmentationAdapter;
import com.example.finstatement.augment.OpenRouterAugmentationAdapter;
import com.example.finstatement.parser.DocumentSectionScanner;
import com.example.finstatement.parser.PositionalTieBreak;
import com.example.finstatement.parser.PriorYearReportParser;
import com.example.finstatement.parser.RowFieldExtractor;
import com.example.finstatement.parser.TextLineFieldExtractor;
import com.example.finstatement.service.ReconciliationValidator;

@Configuration
public class StatementConfig {

    private static final Logger log = LoggerFactory.getLogger(StatementConfig.class);

    @Bean
    public PositionalTieBreak provisionsTieBreak(@Value("${statement.provisions.current-row-limit:15}") int limit) {
        return PositionalTieBreak.leadingRows(limit);
    }

    @Bean
    public DocumentSectionScanner documentSectionScanner() {
        return new DocumentSectionScanner();
    }

    @Bean
    public RowFieldExtractor rowFieldExtractor(PositionalTieBreak tieBreak) {
        return new RowFieldExtractor(tieBreak);
    }

    @Bean
    public TextLineFieldExtractor textLineFieldExtractor(PositionalTieBreak tieBreak, DocumentSectionScanner scanner) {
        return new TextLineFieldExtractor(tieBreak, scanner);
    }

    @Bean
    public PriorYearReportParser priorYearReportParser(DocumentSectionScanner scanner, TextLineFieldExtractor extractor) {
        return new PriorYearReportParser(scanner, extractor);
    }

    @Bean
    public ReconciliationValidator reconciliationValidator(
            @Value("${statement.expected.directors}") List<String> directors,
            @Value("${statement.expected.compiler}") String compiler) {
        log.info("✅ signatory roster: directors={}, compiler={}", directors, compiler);
        return new ReconciliationValidator(directors, compiler);
    }

    @Bean
    public RestTemplate openRouterRestTemplate(RestTemplateBuilder builder,
                                              @Value("${augmentation.timeout-seconds:30}") long timeoutSeconds) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean
    public AugmentationAdapter augmentationAdapter(RestTemplate openRouterRestTemplate,
                                                   @Value("${augmentation.enabled:false}") boolean enabled,
                                                   @Value("${augmentation.openrouter.url}") String url,
                                                   @Value("${augmentation.openrouter.api-key:}") String apiKey,
                                                   @Value("${augmentation.openrouter.models}") List<String> models,
                                                   @Value("${augmentation.timeout-seconds:30}") long timeoutSeconds) {
        if (!enabled || apiKey == null || apiKey.isBlank()) {
            log.info("🤖 augmentation off (enabled={}, api key {})", enabled, apiKey == null || apiKey.isBlank() ? "missing" : "set");
            return new NoOpAugmentationAdapter();
        }
        log.info("🤖 augmentation via OpenRouter, models {}", models);
        return new OpenRouterAugmentationAdapter(openRouterRestTemplate, url, apiKey, models, timeoutSeconds);
    }
}
