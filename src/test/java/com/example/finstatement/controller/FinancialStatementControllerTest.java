package com.example.finstatement.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.example.finstatement.exception.DocumentReadException;
import com.example.finstatement.exception.StatementMissingException;
import com.example.finstatement.model.StatementRequest;
import com.example.finstatement.model.StatementResponse;
import com.example.finstatement.model.StatementType;
import com.example.finstatement.model.ValidationIssue;
import com.example.finstatement.model.ValidationReport;
import com.example.finstatement.reader.PdfPageTextReader;
import com.example.finstatement.reader.WorkbookTableReader;
import com.example.finstatement.service.FinancialStatementService;

@WebMvcTest(FinancialStatementController.class)
class FinancialStatementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FinancialStatementService statementService;
    @MockBean
    private WorkbookTableReader workbookReader;
    @MockBean
    private PdfPageTextReader pdfReader;

    private final MockMultipartFile workbook = new MockMultipartFile(
            "workbook", "accounts.xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", new byte[]{1, 2, 3});
    private final MockMultipartFile priorYear = new MockMultipartFile(
            "priorYearReport", "fy2024.pdf", "application/pdf", new byte[]{4, 5, 6});

    @BeforeEach
    void setUp() {
        when(workbookReader.read(any())).thenReturn(List.of());
        when(pdfReader.read(any())).thenReturn(List.of("Statement of Profit or Loss"));
    }

    private static StatementResponse response(ValidationIssue... issues) {
        StatementResponse res = new StatementResponse();
        res.entityName = "Example Holdings Pty Ltd";
        res.report = new ValidationReport(List.of(issues));
        return res;
    }

    @Test
    @DisplayName("uploads are decoded and form fields reach the service")
    void validateUpload() throws Exception {
        when(statementService.process(any())).thenReturn(response());

        mockMvc.perform(multipart("/statements/validate")
                        .file(workbook)
                        .file(priorYear)
                        .param("directors", "Matthew Warnken, Gary Wyatt")
                        .param("compilerName", "Allan Tuback")
                        .param("priorRetainedEarnings", "$225,000")
                        .param("useAi", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityName").value("Example Holdings Pty Ltd"))
                .andExpect(jsonPath("$.report.overallOk").value(true));

        ArgumentCaptor<StatementRequest> captor = ArgumentCaptor.forClass(StatementRequest.class);
        verify(statementService).process(captor.capture());
        StatementRequest req = captor.getValue();
        assertThat(req.getPriorYearPages()).containsExactly("Statement of Profit or Loss");
        assertThat(req.getDraftPages()).isNull();
        assertThat(req.getDirectors()).containsExactly("Matthew Warnken", "Gary Wyatt");
        assertThat(req.getCompilerName()).isEqualTo("Allan Tuback");
        assertThat(req.getPriorRetainedEarnings()).isEqualByComparingTo("225000");
        assertThat(req.isUseAi()).isFalse();
    }

    @Test
    @DisplayName("a fatal issue is still a 200 carrying overallOk=false")
    void fatalIsNotAnHttpError() throws Exception {
        when(statementService.process(any())).thenReturn(response(
                ValidationIssue.fatal("BALANCE", "Balance sheet does not balance.", BigDecimal.TEN)));

        mockMvc.perform(multipart("/statements/validate").file(workbook).file(priorYear))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.overallOk").value(false))
                .andExpect(jsonPath("$.report.fatals[0].code").value("BALANCE"));
    }

    @Test
    void missingStatementIsUnprocessable() throws Exception {
        when(statementService.process(any()))
                .thenThrow(new StatementMissingException(StatementType.BALANCE_SHEET, "sheet"));

        mockMvc.perform(multipart("/statements/validate").file(workbook).file(priorYear))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("STATEMENT_MISSING"));
    }

    @Test
    void unreadableUploadIsBadRequest() throws Exception {
        when(pdfReader.read(any())).thenThrow(new DocumentReadException("cannot read PDF: bad header", null));

        mockMvc.perform(multipart("/statements/validate").file(workbook).file(priorYear))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOCUMENT_UNREADABLE"));
        verify(statementService, never()).process(any());
    }

    @Test
    void missingPartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/statements/validate").file(workbook))
                .andExpect(status().isBadRequest());
    }

    @Test
    void emptyWorkbookIsRejected() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("workbook", "empty.xlsx", "application/octet-stream", new byte[0]);

        mockMvc.perform(multipart("/statements/validate").file(empty).file(priorYear))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("workbook is empty"));
    }

    @Test
    void badAmountIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/statements/validate").file(workbook).file(priorYear)
                        .param("priorRetainedEarnings", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void validateJson() throws Exception {
        when(statementService.process(any())).thenReturn(response());
        String body = "{\"tables\":[{\"name\":\"Consol PL\",\"rows\":[[\"Revenue\",1000]]}],"
                + "\"priorYearPages\":[\"Statement of Profit or Loss\"],\"useAi\":false}";

        mockMvc.perform(post("/statements/validate-json").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entityName").value("Example Holdings Pty Ltd"));

        ArgumentCaptor<StatementRequest> captor = ArgumentCaptor.forClass(StatementRequest.class);
        verify(statementService).process(captor.capture());
        assertThat(captor.getValue().getTables()).singleElement()
                .satisfies(t -> assertThat(t.getRows().get(0)).containsExactly("Revenue", 1000));
        assertThat(captor.getValue().isUseAi()).isFalse();
    }

    @Test
    void splitNamesTrimsAndDropsBlanks() {
        assertThat(FinancialStatementController.splitNames(" A , ,B ")).containsExactly("A", "B");
        assertThat(FinancialStatementController.splitNames("  ")).isNull();
    }
}
