package io.github.riemr.sampling.application.util;

import java.util.ArrayList;
import java.util.List;

/**
 * 表計算ソフトから書き出した CSV 向けの最小限の処理（ダブルクォート対応、BOM 除去）。
 */
public final class CsvUtils {
    private CsvUtils() {}

    private static final char BOM = '\uFEFF';

    public static String stripBom(String line) {
        if (line != null && !line.isEmpty() && line.charAt(0) == BOM) {
            return line.substring(1);
        }
        return line;
    }

    /** クォート内のカンマと "" エスケープを考慮して 1 行を分割する。各セルは前後の空白を除去 */
    public static List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cur.toString().strip());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        cells.add(cur.toString().strip());
        return cells;
    }

    public static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
