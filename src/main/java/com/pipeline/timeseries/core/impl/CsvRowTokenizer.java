package com.pipeline.timeseries.core.impl;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * CSV行切分器。
 * 先清洗掉可打印ASCII以外的字符（BOM、控制字符、表格软件导出的杂字节），
 * 再按逗号切分，支持双引号包裹和反斜杠转义。
 * 反斜杠后面不是引号或反斜杠时，opencsv会丢掉这个反斜杠（A\B 切分为 AB），
 * 该行照常导入，不算格式错误。
 */
public class CsvRowTokenizer {

    public static final char DEFAULT_SEPARATOR = ',';
    public static final char DEFAULT_QUOTE = '"';
    public static final char DEFAULT_ESCAPE = '\\';

    private final CSVParser parser;

    public CsvRowTokenizer() {
        this(DEFAULT_SEPARATOR, DEFAULT_QUOTE, DEFAULT_ESCAPE);
    }

    public CsvRowTokenizer(char separator, char quote, char escape) {
        this.parser = new CSVParserBuilder()
                .withSeparator(separator)
                .withQuoteChar(quote)
                .withEscapeChar(escape)
                .build();
    }

    /**
     * 去掉 [32, 126] 以外的全部字符
     */
    public static String sanitize(String line) {
        if (line == null) return "";
        StringBuilder sb = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c >= 32 && c <= 126) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 清洗并切分一行。
     *
     * @param line 原始行
     * @return 字段列表；空行返回只含一个空字段的列表
     * @throws IOException 引号未闭合等无法切分的情况
     */
    public List<String> tokenize(String line) throws IOException {
        String[] tokens = parser.parseLine(sanitize(line));
        if (tokens == null) {
            return Collections.emptyList();
        }
        return Arrays.asList(tokens);
    }
}
