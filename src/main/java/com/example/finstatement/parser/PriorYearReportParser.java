package com.example.finstatement.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.finstatement.model.NoteSection;
import com.example.finstatement.model.PriorYearReport;
import com.example.finstatement.model.Signatory;

/**
 * Structural read of last year's printed report: who the entity is, which year it covers,
 * how the document is laid out and who signed it, plus the comparative figures.
 */
public class PriorYearReportParser {

    private static final Logger log = LoggerFactory.getLogger(PriorYearReportParser.class);

    private static final Pattern P_YEAR_ENDED = Pattern.compile(
            "for the (?:year|period) ended\\s+\\d{1,2}\\s+[a-z]+\\s+(\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern P_CONTENTS_ENTRY = Pattern.compile("^(?:\\d+\\.?\\s+)?(.+?)[\\s.]+(\\d{1,3})$");
    private static final Pattern P_NOTE_HEADING = Pattern.compile("^(\\d{1,2})\\.?\\s+([A-Z][^\\d]{2,80})$");
    private static final Pattern P_HEAD_ENTITY = Pattern.compile(
            "(?i:head entity)(?:\\s+of the (?:income )?tax[- ]consolidated group)?(?:\\s+(?:is|being))?[\\s,:]+"
                    + "([A-Z][A-Za-z0-9&'.\\- ]*?\\s(?:Pty\\.?\\s*Ltd|Limited|Ltd))");
    private static final Pattern P_SIGNATURE_NOISE = Pattern.compile("_+|\\s*Date:?.*$|\\s*Dated:?.*$");
    private static final Pattern P_PERSON_NAME = Pattern.compile("[A-Z][A-Za-z.'\\-]*(?:\\s+[A-Za-z.'\\-]+){1,5}");

    private static final int CONTINGENT_BEFORE = 2;
    private static final int CONTINGENT_AFTER = 5;

    private final DocumentSectionScanner scanner;
    private final TextLineFieldExtractor extractor;

    public PriorYearReportParser(DocumentSectionScanner scanner, TextLineFieldExtractor extractor) {
        this.scanner = scanner;
        this.extractor = extractor;
    }

    public PriorYearReport parse(List<String> pages) {
        List<DocumentSectionScanner.Block> blocks = scanner.scan(pages);

        PriorYearReport report = new PriorYearReport();
        report.entityName = entityName(pages);
        report.priorYear = priorYear(pages);
        report.contents = contents(blocks);
        report.notes = notes(blocks);
        report.directors = directors(scanner.linesOf(blocks, DocumentSection.DIRECTORS_DECLARATION));
        report.compiler = compiler(scanner.linesOf(blocks, DocumentSection.COMPILATION_REPORT));
        report.taxConsolidationEntity = taxConsolidationEntity(pages);
        report.contingentLiabilityText = contingentLiabilityText(blocks);
        report.dataset = extractor.extractPriorPeriod(pages);

        log.info("✅ prior-year report: entity={}, year={}, notes={}, directors={}, compiler={}",
                report.entityName, report.priorYear, report.notes.size(), report.directors.size(),
                report.compiler == null ? null : report.compiler.getName());
        return report;
    }

    /** Note headings only; used for a draft where the figures are not trusted. */
    public List<NoteSection> parseNotes(List<String> pages) {
        return notes(scanner.scan(pages));
    }

    // -------------------- cover page --------------------
    String entityName(List<String> pages) {
        if (pages.isEmpty() || pages.get(0) == null) return null;
        List<String> lines = nonBlankLines(pages.get(0));
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).toLowerCase(Locale.ROOT).contains("financial statements")) continue;
            if (i + 1 < lines.size() && looksLikeEntity(lines.get(i + 1))) return lines.get(i + 1);
            if (i > 0 && looksLikeEntity(lines.get(i - 1))) return lines.get(i - 1);
            return null;
        }
        return null;
    }

    private boolean looksLikeEntity(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return !lower.startsWith("for the year ended")
                && !lower.startsWith("for the period ended")
                && !lower.contains("financial statements")
                && !lower.startsWith("abn")
                && !lower.startsWith("acn")
                && line.chars().anyMatch(Character::isLetter);
    }

    Integer priorYear(List<String> pages) {
        for (String page : pages) {
            if (page == null) continue;
            Matcher m = P_YEAR_ENDED.matcher(page);
            if (m.find()) return Integer.valueOf(m.group(1));
        }
        return null;
    }

    // -------------------- layout --------------------
    Map<String, Integer> contents(List<DocumentSectionScanner.Block> blocks) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String line : scanner.linesOf(blocks, DocumentSection.CONTENTS)) {
            Matcher m = P_CONTENTS_ENTRY.matcher(line);
            if (m.matches()) {
                out.putIfAbsent(m.group(1).trim(), Integer.valueOf(m.group(2)));
            }
        }
        return out;
    }

    /**
     * A note opens on "N. Heading" where N is higher than the previous note number, so
     * numbered lists inside a note stay part of its content.
     */
    List<NoteSection> notes(List<DocumentSectionScanner.Block> blocks) {
        List<NoteSection> notes = new ArrayList<>();
        NoteSection open = null;
        for (String line : scanner.linesOf(blocks, DocumentSection.NOTES)) {
            Matcher m = P_NOTE_HEADING.matcher(line);
            if (m.matches()) {
                int number = Integer.parseInt(m.group(1));
                if (open == null || number > open.getNumber()) {
                    open = new NoteSection(number, m.group(2).trim());
                    notes.add(open);
                    continue;
                }
            }
            if (open != null) open.getContent().add(line);
        }
        return notes;
    }

    // -------------------- signatories --------------------
    List<Signatory> directors(List<String> lines) {
        List<Signatory> out = new ArrayList<>();
        for (int i = 0; i + 1 < lines.size(); i++) {
            String title = lines.get(i + 1);
            if (!title.contains("Director")) continue;
            String name = cleanName(lines.get(i));
            if (name != null && !name.contains("Director")) {
                out.add(new Signatory(name, title));
            }
        }
        return out;
    }

    Signatory compiler(List<String> lines) {
        for (int i = 0; i + 2 < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.contains("_____") && !line.startsWith("Date:")) continue;
            String name = cleanName(lines.get(i + 1));
            if (name != null) {
                return new Signatory(name, lines.get(i + 2));
            }
        }
        return null;
    }

    private String cleanName(String line) {
        String name = P_SIGNATURE_NOISE.matcher(line).replaceAll("").trim();
        if (name.length() <= 3 || !P_PERSON_NAME.matcher(name).matches()) return null;
        return name;
    }

    // -------------------- disclosures --------------------
    String taxConsolidationEntity(List<String> pages) {
        for (String page : pages) {
            if (page == null) continue;
            Matcher m = P_HEAD_ENTITY.matcher(page.replaceAll("\\s+", " "));
            if (m.find()) return m.group(1).trim();
        }
        return null;
    }

    /** Lines around the first mention outside the contents page. */
    String contingentLiabilityText(List<DocumentSectionScanner.Block> blocks) {
        for (DocumentSectionScanner.Block block : blocks) {
            if (block.getSection() == DocumentSection.CONTENTS) continue;
            List<String> lines = block.getLines();
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.toLowerCase(Locale.ROOT).contains("contingent") || line.contains("TENBS")) {
                    int from = Math.max(0, i - CONTINGENT_BEFORE);
                    int to = Math.min(lines.size(), i + CONTINGENT_AFTER);
                    return String.join("\n", lines.subList(from, to));
                }
            }
        }
        return null;
    }

    private static List<String> nonBlankLines(String page) {
        List<String> out = new ArrayList<>();
        for (String raw : page.split("\\r?\\n")) {
            String line = raw.trim();
            if (!line.isEmpty()) out.add(line);
        }
        return out;
    }
}
