package com.mirrorwatch.watch.analysis;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.model.Analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an analysis reply into its {@code 【Section】}-headed parts.
 */
public class AnalysisSectionParser {
    private static final String OPEN = "【";
    private static final String CLOSE = "】";

    private final WatchProperties.Sections sections;

    public AnalysisSectionParser(WatchProperties.Sections sections) {
        this.sections = sections;
    }

    public Analysis parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new AnalysisUnavailableException("Empty analysis reply");
        }
        List<String> missing = new ArrayList<>();
        String translation = require(reply, sections.getTranslation(), missing);
        String summary = require(reply, sections.getSummary(), missing);
        String tags = require(reply, sections.getTags(), missing);
        String category = require(reply, sections.getCategory(), missing);
        if (!missing.isEmpty()) {
            throw new AnalysisUnavailableException("Analysis reply lacks sections " + missing);
        }
        return new Analysis(translation, summary, tags, category, reply.strip());
    }

    private static String require(String reply, String section, List<String> missing) {
        String value = extract(reply, section);
        if (value == null) {
            missing.add(section);
        }
        return value;
    }

    /**
     * @return the trimmed, blank-line-free body of {@code section}, or {@code null} when the header is absent
     */
    public static String extract(String reply, String section) {
        if (reply == null || section == null) {
            return null;
        }
        String header = OPEN + section + CLOSE;
        int start = reply.indexOf(header);
        if (start < 0) {
            return null;
        }
        start += header.length();
        int end = reply.indexOf(OPEN, start);
        String body = end < 0 ? reply.substring(start) : reply.substring(start, end);
        StringBuilder out = new StringBuilder();
        for (String line : body.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(trimmed);
        }
        return out.toString();
    }
}
