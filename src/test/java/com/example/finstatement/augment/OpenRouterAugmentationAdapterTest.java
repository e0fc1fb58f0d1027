package com.example.finstatement.augment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.example.finstatement.model.ReportingPeriod;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

@DisplayName("OpenRouterAugmentationAdapter")
class OpenRouterAugmentationAdapterTest {

    private static final String URL = "https://openrouter.ai/api/v1/chat/completions";

    private RestTemplate restTemplate;
    private OpenRouterAugmentationAdapter adapter;

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        adapter = new OpenRouterAugmentationAdapter(restTemplate, URL, "test-key",
                List.of("model-a", "model-b"), 5);
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private static String chatBody(String content) {
        JsonObject message = new JsonObject();
        message.addProperty("role", "assistant");
        message.addProperty("content", content);
        JsonObject choice = new JsonObject();
        choice.add("message", message);
        JsonArray choices = new JsonArray();
        choices.add(choice);
        JsonObject root = new JsonObject();
        root.add("choices", choices);
        return root.toString();
    }

    private static FinancialDataset partialPrior() {
        Map<Category, BigDecimal> v = new EnumMap<>(Category.class);
        v.put(Category.REVENUE, new BigDecimal("900000"));
        return FinancialDataset.of(ReportingPeriod.PRIOR, v);
    }

    @Test
    void fencedAnswersAreUnwrapped() {
        assertThat(OpenRouterAugmentationAdapter.extractJson("Sure:\n```json\n{\"a\":1}\n```\nDone"))
                .isEqualTo("{\"a\":1}");
        assertThat(OpenRouterAugmentationAdapter.extractJson("```\n{\"b\":2}\n```")).isEqualTo("{\"b\":2}");
        assertThat(OpenRouterAugmentationAdapter.extractJson("  {\"c\":3} ")).isEqualTo("{\"c\":3}");
    }

    @Test
    void contentOfReadsFirstChoice() {
        assertThat(OpenRouterAugmentationAdapter.contentOf(chatBody("hello"))).isEqualTo("hello");
        assertThat(OpenRouterAugmentationAdapter.contentOf("{\"choices\":[]}")).isNull();
        assertThat(OpenRouterAugmentationAdapter.contentOf(null)).isNull();
    }

    @Test
    @DisplayName("proposals never touch extracted values and skip non-numeric entries")
    void parseDatasetKeepsOnlyGaps() {
        FinancialDataset proposed = adapter.parseDataset(
                "{\"revenue\": 1, \"ebitda\": 260000, \"cash\": \"unknown\", \"made_up\": 5}", partialPrior());

        assertThat(proposed.getPeriod()).isEqualTo(ReportingPeriod.PRIOR);
        assertThat(proposed.asMap()).containsOnlyKeys(Category.EBITDA);
        assertThat(proposed.amount(Category.EBITDA)).isEqualByComparingTo("260000");
    }

    @Test
    void adviceCollectsIssuesThenRecommendations() {
        List<String> advice = adapter.parseAdvice(
                "```json\n{\"issues\":[\"Margin fell\"],\"recommendations\":[\"Check stock count\"]}\n```");

        assertThat(advice).containsExactly("Margin fell", "Check stock count");
    }

    @Test
    @DisplayName("a failing model falls through to the next one")
    void modelFallback() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"))
                .thenReturn(ResponseEntity.ok(chatBody("{\"ebitda\": 260000}")));

        Optional<FinancialDataset> result = adapter.augment(partialPrior(), "Revenue 900,000\nEBITDA 260,000");

        assertThat(result).hasValueSatisfying(ds ->
                assertThat(ds.amount(Category.EBITDA)).isEqualByComparingTo("260000"));
        verify(restTemplate, times(2)).postForEntity(eq(URL), any(), eq(String.class));
    }

    @Test
    void allModelsFailingYieldsNothing() {
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("down"));

        assertThat(adapter.augment(partialPrior(), "Revenue 900,000")).isEmpty();
        assertThat(adapter.advise(partialPrior(), partialPrior())).isEmpty();
    }

    @Test
    @DisplayName("a slow provider is abandoned after the timeout")
    void timeoutYieldsNothing() {
        OpenRouterAugmentationAdapter slow = new OpenRouterAugmentationAdapter(restTemplate, URL, "test-key",
                List.of("model-a"), 1);
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class))).thenAnswer(inv -> {
            Thread.sleep(5000);
            return ResponseEntity.ok(chatBody("{\"ebitda\": 1}"));
        });

        try {
            assertThat(slow.augment(partialPrior(), "Revenue 900,000")).isEmpty();
        } finally {
            slow.shutdown();
        }
    }

    @Test
    void unreadableAnswerYieldsNothing() {
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenReturn(ResponseEntity.ok(chatBody("I could not find any figures.")));

        assertThat(adapter.augment(partialPrior(), "Revenue 900,000")).isEmpty();
    }

    @Test
    void disabledWithoutKey() {
        OpenRouterAugmentationAdapter keyless = new OpenRouterAugmentationAdapter(restTemplate, URL, "",
                List.of("model-a"), 5);
        try {
            assertThat(keyless.isEnabled()).isFalse();
            assertThat(keyless.augment(partialPrior(), "Revenue 900,000")).isEmpty();
            assertThat(keyless.advise(partialPrior(), partialPrior())).isEmpty();
            verifyNoInteractions(restTemplate);
        } finally {
            keyless.shutdown();
        }
    }

    @Test
    void noOpAdapterIsDisabled() {
        NoOpAugmentationAdapter noOp = new NoOpAugmentationAdapter();

        assertThat(noOp.isEnabled()).isFalse();
        assertThat(noOp.augment(partialPrior(), "text")).isEmpty();
        assertThat(noOp.advise(partialPrior(), partialPrior())).isEmpty();
    }
}
