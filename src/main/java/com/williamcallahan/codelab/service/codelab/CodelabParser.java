package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;

import java.util.List;

/**
 * Parses codelab sources of one authoring format.
 */
public interface CodelabParser {

    /**
     * Returns the format name this parser is registered under, such as {@code md}.
     *
     * @return format name
     */
    String format();

    /**
     * Parses a complete codelab.
     *
     * @param source codelab source text
     * @param options metadata pass-through options
     * @return the parsed, frozen codelab
     * @throws CodelabParseException when the source cannot be parsed
     */
    Codelab parse(String source, ParseOptions options);

    /**
     * Parses a fragment meant to be imported into a step of another codelab.
     *
     * @param source fragment source text
     * @return fragment content
     * @throws CodelabParseException when the fragment declares steps or imports
     */
    List<CodelabNode> parseFragment(String source);
}
