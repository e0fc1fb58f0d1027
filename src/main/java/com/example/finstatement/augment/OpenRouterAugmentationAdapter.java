package com.example.finstatement.augment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.example.finstatement.model.Category;
import com.example.finstatement.model.FinancialDataset;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * OpenRouter chat-completions client. Models are tried in order until one answers; the
 * whole exchange is bounded by a timeout, after which the pipeline continues without it.
 */
public class OpenRouterAugmentationAdapter implements AugmentationAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterAugmentationAdapter.class);

    private static final int MAX_SOURCE_CHARS = 12000;
    private static final double TEMPERATURE = 0.3;

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;
    private final List<String> models;
    private final long timeoutSeconds;
    private final Gson gson = new Gson();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public OpenRouterAugmentationAdapter(RestTemplate restTemplate, String url, String apiKey,
                                         List<String> models, long timeoutSeconds) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.apiKey = apiKey;
        this.models = List.copyOf(models);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank() && !models.isEmpty();
    }

    // -------------------- gap fill --------------------
    @Override
    public Optional<FinancialDataset> augment(FinancialDataset partial, String sourceText) {
        if (!isEnabled() || sourceText == null || sourceText.isBlank()) return Optional.empty();

        List<String> missing = new ArrayList<>();
        for (Category c : Category.values()) {
            if (!partial.has(c)) missing.add(c.getKey());
        }
        if (missing.isEmpty()) return Optional.empty();

        String text = sourceText.length() > MAX_SOURCE_CHARS ? sourceText.substring(0, MAX_SOURCE_CHARS) : sourceText;
        String prompt = "Extract these line items from the financial statement text below: "
                + String.join(", ", missing)
                + ".\nReturn only a JSON object mapping each key you can find to a plain number "
                + "(negative for losses, no currency symbols). Omit keys you cannot find.\n\n"
                + text;

        String content = completeWithTimeout(prompt);
        if (content == null) return Optional.empty();
        try {
            FinancialDataset proposed = parseDataset(content, partial);
            if (proposed.asMap().isEmpty()) return Optional.empty();
            log.info("🤖 augmentation proposed {} value(s): {}", proposed.asMap().size(), proposed.getValues().keySet());
            return Optional.of(proposed);
        } catch (JsonParseException | IllegalStateException e) {
            log.warn("⚠️ augmentation skipped, unreadable answer: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Numeric entries for categories absent from {@code partial}; other keys are dropped. */
    FinancialDataset parseDataset(String content, FinancialDataset partial) {
        JsonObject obj = JsonParser.parseString(extractJson(content)).getAsJsonObject();
        Map<Category, BigDecimal> values = new EnumMap<>(Category.class);
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            Category c = Category.fromKey(e.getKey());
            if (c == null || partial.has(c)) continue;
            JsonElement v = e.getValue();
            if (v == null || !v.isJsonPrimitive() || !v.getAsJsonPrimitive().isNumber()) continue;
            values.put(c, v.getAsBigDecimal());
        }
        return FinancialDataset.of(partial.getPeriod(), values);
    }

    // -------------------- review --------------------
    @Override
    public List<String> advise(FinancialDataset current, FinancialDataset prior) {
        if (!isEnabled()) return Collections.emptyList();

        String prompt = "You review Australian special-purpose financial statements (AASB, non-reporting entity).\n"
                + "Check the relationships between these figures and compare them with the prior year.\n"
                + "Return only JSON: {\"issues\": [\"...\"], \"recommendations\": [\"...\"]}.\n\n"
                + "Current year: " + gson.toJson(current.getValues()) + "\n"
                + "Current totals: " + gson.toJson(current.getTotals()) + "\n"
                + "Prior year: " + gson.toJson(prior.getValues());

        String content = completeWithTimeout(prompt);
        if (content == null) return Collections.emptyList();
        try {
            return parseAdvice(content);
        } catch (JsonParseException | IllegalStateException e) {
            log.warn("⚠️ review skipped, unreadable answer: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    List<String> parseAdvice(String content) {
        JsonObject obj = JsonParser.parseString(extractJson(content)).getAsJsonObject();
        List<String> out = new ArrayList<>();
        for (String field : List.of("issues", "recommendations")) {
            if (!obj.has(field) || !obj.get(field).isJsonArray()) continue;
            for (JsonElement e : obj.getAsJsonArray(field)) {
                if (e.isJsonPrimitive()) out.add(e.getAsString());
            }
        }
        return out;
    }

    // -------------------- transport --------------------
    private String completeWithTimeout(String prompt) {
        Future<String> future = executor.submit(() -> complete(prompt));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏰ augmentation timed out after {}s, continuing without it", timeoutSeconds);
        } catch (ExecutionException e) {
            log.warn("⚠️ augmentation failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ augmentation interrupted");
        }
        return null;
    }

    /** First model that answers wins; null when every model failed. */
    String complete(String prompt) {
        for (String model : models) {
            try {
                String content = callModel(model, prompt);
                if (content != null && !content.isBlank()) {
                    log.debug("model {} answered", model);
                    return content;
                }
            } catch (RestClientException | JsonParseException | IllegalStateException e) {
                log.warn("⚠️ model {} failed: {}, trying next", model, e.getMessage());
            }
        }
        return null;
    }

    private String callModel(String model, String prompt) {
        JsonObject message = new JsonObject();
        message.addProperty("role", "user");
        message.addProperty("content", prompt);
        JsonArray messages = new JsonArray();
        messages.add(message);

        JsonObject payload = new JsonObject();
        payload.addProperty("model", model);
        payload.add("messages", messages);
        payload.addProperty("temperature", TEMPERATURE);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        headers.set("X-Title", "AASB Financial Statement Generator");

        ResponseEntity<String> response = restTemplate.postForEntity(
                url, new HttpEntity<>(gson.toJson(payload), headers), String.class);
        return contentOf(response.getBody());
    }

    static String contentOf(String responseBody) {
        if (responseBody == null) return null;
        JsonObject root = JsonParser.parseString(responseBody).getAsJsonObject();
        JsonArray choices = root.getAsJsonArray("choices");
        if (choices == null || choices.size() == 0) return null;
        JsonObject msg = choices.get(0).getAsJsonObject().getAsJsonObject("message");
        return msg == null || !msg.has("content") || msg.get("content").isJsonNull() ? null : msg.get("content").getAsString();
    }

    /** Body of a ```json fence, else of a bare ``` fence, else the whole answer. */
    static String extractJson(String content) {
        String c = content.trim();
        int fence = c.indexOf("```json");
        if (fence >= 0) {
            int start = fence + "```json".length();
            int end = c.indexOf("```", start);
            return (end < 0 ? c.substring(start) : c.substring(start, end)).trim();
        }
        fence = c.indexOf("```");
        if (fence >= 0) {
            int start = fence + 3;
            int end = c.indexOf("```", start);
            return (end < 0 ? c.substring(start) : c.substring(start, end)).trim();
        }
        return c;
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
