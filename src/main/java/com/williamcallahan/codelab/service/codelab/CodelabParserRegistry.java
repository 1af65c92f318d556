package com.williamcallahan.codelab.service.codelab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves codelab parsers by format name. Built once from every registered parser.
 */
@Component
public class CodelabParserRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CodelabParserRegistry.class);

    private final Map<String, CodelabParser> parsersByFormat;

    public CodelabParserRegistry(List<CodelabParser> parsers) {
        Map<String, CodelabParser> byFormat = new LinkedHashMap<>();
        for (CodelabParser parser : parsers) {
            String format = normalize(parser.format());
            CodelabParser previous = byFormat.putIfAbsent(format, parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate codelab parser for format '" + format + "'");
            }
        }
        this.parsersByFormat = Map.copyOf(byFormat);
        logger.info("Registered codelab parsers for formats {}", byFormat.keySet());
    }

    /**
     * Returns the parser for a format.
     *
     * @param format format name, case-insensitive
     * @return registered parser
     * @throws UnknownCodelabFormatException when no parser handles the format
     */
    public CodelabParser forFormat(String format) {
        CodelabParser parser = format == null ? null : parsersByFormat.get(normalize(format));
        if (parser == null) {
            throw new UnknownCodelabFormatException(format);
        }
        return parser;
    }

    public Set<String> formats() {
        return parsersByFormat.keySet();
    }

    private static String normalize(String format) {
        return format.trim().toLowerCase(Locale.ROOT);
    }
}
