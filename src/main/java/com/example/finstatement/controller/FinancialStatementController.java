package com.example.finstatement.controller;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.example.finstatement.exception.DocumentReadException;
import com.example.finstatement.model.StatementRequest;
import com.example.finstatement.model.StatementResponse;
import com.example.finstatement.reader.PdfPageTextReader;
import com.example.finstatement.reader.WorkbookTableReader;
import com.example.finstatement.service.FinancialStatementService;
import com.example.finstatement.utils.MoneyUtils;

/**
 * A fatal validation issue still answers 200 with {@code report.overallOk=false}; the caller
 * must not generate statements from it. A statement that cannot be found answers 422.
 */
@RestController
@RequestMapping("/statements")
public class FinancialStatementController {

    private static final Logger log = LoggerFactory.getLogger(FinancialStatementController.class);

    private final FinancialStatementService statementService;
    private final WorkbookTableReader workbookReader;
    private final PdfPageTextReader pdfReader;

    public FinancialStatementController(FinancialStatementService statementService,
                                        WorkbookTableReader workbookReader,
                                        PdfPageTextReader pdfReader) {
        this.statementService = statementService;
        this.workbookReader = workbookReader;
        this.pdfReader = pdfReader;
    }

    @PostMapping("/validate")
    public ResponseEntity<?> validate(
            @RequestParam("workbook") MultipartFile workbook,
            @RequestParam("priorYearReport") MultipartFile priorYearReport,
            @RequestParam(value = "draftReport", required = false) MultipartFile draftReport,
            @RequestParam(value = "directors", required = false) String directors,
            @RequestParam(value = "compilerName", required = false) String compilerName,
            @RequestParam(value = "compilerTitle", required = false) String compilerTitle,
            @RequestParam(value = "priorRetainedEarnings", required = false) String priorRetainedEarnings,
            @RequestParam(value = "useAi", defaultValue = "true") boolean useAi
    ) {
        if (workbook == null || workbook.isEmpty()) {
            return ResponseEntity.badRequest().body("workbook is empty");
        }
        if (priorYearReport == null || priorYearReport.isEmpty()) {
            return ResponseEntity.badRequest().body("priorYearReport is empty");
        }
        log.info("📥 validate: workbook={}, priorYearReport={}, draftReport={}",
                workbook.getOriginalFilename(), priorYearReport.getOriginalFilename(),
                draftReport == null ? null : draftReport.getOriginalFilename());

        StatementRequest request = new StatementRequest();
        try (InputStream in = workbook.getInputStream()) {
            request.setTables(workbookReader.read(in));
        } catch (IOException e) {
            throw new DocumentReadException("cannot open upload " + workbook.getOriginalFilename(), e);
        }
        request.setPriorYearPages(pdfReader.read(bytes(priorYearReport)));
        if (draftReport != null && !draftReport.isEmpty()) {
            request.setDraftPages(pdfReader.read(bytes(draftReport)));
        }
        request.setDirectors(splitNames(directors));
        request.setCompilerName(compilerName);
        request.setCompilerTitle(compilerTitle);
        request.setPriorRetainedEarnings(MoneyUtils.parse(priorRetainedEarnings));
        request.setUseAi(useAi);

        return ResponseEntity.ok(statementService.process(request));
    }

    @PostMapping("/validate-json")
    public ResponseEntity<StatementResponse> validateJson(@RequestBody StatementRequest request) {
        log.info("📥 validate-json: {} table(s), {} prior-year page(s)",
                request.getTables() == null ? 0 : request.getTables().size(),
                request.getPriorYearPages() == null ? 0 : request.getPriorYearPages().size());
        return ResponseEntity.ok(statementService.process(request));
    }

    private static byte[] bytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new DocumentReadException("cannot open upload " + file.getOriginalFilename(), e);
        }
    }

    static List<String> splitNames(String names) {
        if (names == null || names.isBlank()) return null;
        List<String> out = new ArrayList<>();
        for (String n : names.split(",")) {
            if (!n.isBlank()) out.add(n.trim());
        }
        return out;
    }
}
