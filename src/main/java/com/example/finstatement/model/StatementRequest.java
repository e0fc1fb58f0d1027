package com.example.finstatement.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded inputs for one validation run. The multipart endpoint fills it from uploaded
 * files; the JSON endpoint receives it as is.
 */
@Data
@NoArgsConstructor
public class StatementRequest {
    private List<SourceTable> tables = new ArrayList<>();
    private List<String> priorYearPages = new ArrayList<>();
    // optional draft of the current report; only its note headings are used
    private List<String> draftPages;
    private List<String> directors;
    private String compilerName;
    private String compilerTitle;
    private BigDecimal priorRetainedEarnings;
    private boolean useAi = true;
}
