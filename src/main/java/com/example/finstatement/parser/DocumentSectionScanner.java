package com.example.finstatement.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits report pages into sections. A heading line opens a section; every following line
 * belongs to it until the next recognised heading or the end of the document. Lines before
 * the first heading belong to no section.
 */
public class DocumentSectionScanner {

    private static final Logger log = LoggerFactory.getLogger(DocumentSectionScanner.class);

    // "Statement of Financial Position ........ 4" on a contents page
    private static final Pattern P_CONTENTS_ENTRY = Pattern.compile(".*[\\s.]\\d{1,3}$");
    // 12,000 or (4,000): a line carrying an amount is a data row, not a heading
    private static final Pattern P_AMOUNT = Pattern.compile("\\d{1,3}(?:,\\d{3})+|\\(\\s*\\d");
    private static final String CONSOLIDATED = "consolidated ";
    // what may follow a heading on its own line: "... and other comprehensive income",
    // "... for the year ended 30 june 2024", "... as at 30 june 2024", "(continued)"
    private static final Pattern P_HEADING_SUFFIX = Pattern.compile(
            "(?: and other comprehensive income)?"
                    + "(?: (?:for the (?:financial )?(?:year|period) ended|as at)\\b.*)?"
                    + "(?: ?\\(continued\\))?");
    // "compilation report to the members of ..."
    private static final Pattern P_ADDRESSEE = Pattern.compile(" to .+");

    /** One section occurrence with the lines under its heading. */
    public static final class Block {
        private final DocumentSection section;
        private final String heading;
        private final int page;
        private final List<String> lines = new ArrayList<>();

        Block(DocumentSection section, String heading, int page) {
            this.section = section;
            this.heading = heading;
            this.page = page;
        }

        public DocumentSection getSection() {
            return section;
        }

        public String getHeading() {
            return heading;
        }

        /** Zero-based page the heading was found on. */
        public int getPage() {
            return page;
        }

        public List<String> getLines() {
            return Collections.unmodifiableList(lines);
        }

        @Override
        public String toString() {
            return section + "@" + page + " '" + heading + "' (" + lines.size() + " lines)";
        }
    }

    public List<Block> scan(List<String> pages) {
        List<Block> blocks = new ArrayList<>();
        Block open = null;

        for (int p = 0; p < pages.size(); p++) {
            String page = pages.get(p);
            if (page == null) continue;

            for (String raw : page.split("\\r?\\n")) {
                String line = raw.trim();
                if (line.isEmpty()) continue;

                DocumentSection heading = headingOf(line);
                if (heading != null) {
                    open = new Block(heading, line, p);
                    blocks.add(open);
                    continue;
                }
                if (open != null) open.lines.add(line);
            }
        }
        log.debug("sections found: {}", blocks);
        return blocks;
    }

    /** Lines of every occurrence of {@code section}, in document order. */
    public List<String> linesOf(List<Block> blocks, DocumentSection section) {
        List<String> out = new ArrayList<>();
        for (Block b : blocks) {
            if (b.section == section) out.addAll(b.lines);
        }
        return out;
    }

    public boolean contains(List<Block> blocks, DocumentSection section) {
        for (Block b : blocks) {
            if (b.section == section) return true;
        }
        return false;
    }

    /**
     * The section this line opens, or null if it is not a heading. The whole line must be the
     * heading, optionally prefixed by "Consolidated" and followed by a period or "(continued)";
     * a sentence that merely starts with a heading's words is narrative.
     */
    public DocumentSection headingOf(String line) {
        String text = normalise(line);
        if (text.isEmpty() || P_AMOUNT.matcher(text).find()) return null;
        if (P_CONTENTS_ENTRY.matcher(text).matches()) return null;

        if (text.startsWith(CONSOLIDATED)) {
            text = text.substring(CONSOLIDATED.length());
        }
        for (DocumentSection section : DocumentSection.values()) {
            for (String h : section.getHeadings()) {
                String heading = h.toLowerCase(Locale.ROOT);
                if (!text.startsWith(heading)) continue;

                String rest = text.substring(heading.length());
                if (P_HEADING_SUFFIX.matcher(rest).matches()) return section;
                if (section == DocumentSection.COMPILATION_REPORT && P_ADDRESSEE.matcher(rest).matches()) return section;
            }
        }
        return null;
    }

    private static String normalise(String line) {
        return line.replace('’', '\'')
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
    }
}
