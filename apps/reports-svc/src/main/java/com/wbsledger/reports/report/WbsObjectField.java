package com.wbsledger.reports.report;

import java.util.regex.Pattern;

/**
 * Parts of an object field as exported next to budget figures: an optional level
 * marker of one to five asterisks, free text, and the code as the last token.
 */
public record WbsObjectField(String level, String text, String code) {

    private static final Pattern LEVEL = Pattern.compile("\\*{1,5}");

    public static WbsObjectField parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new WbsObjectField("", "", "");
        }
        String[] parts = raw.trim().split("\\s+");
        if (parts.length < 2) {
            return new WbsObjectField("", "", parts[0]);
        }
        String code = parts[parts.length - 1];
        int textStart = 0;
        String level = "";
        if (LEVEL.matcher(parts[0]).matches()) {
            level = parts[0];
            textStart = 1;
        }
        StringBuilder text = new StringBuilder();
        for (int i = textStart; i < parts.length - 1; i++) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(parts[i]);
        }
        return new WbsObjectField(level, text.toString(), code);
    }
}
