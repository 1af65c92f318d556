package com.williamcallahan.codelab.web;

import java.util.List;

/**
 * Request body for codelab and fragment parsing.
 *
 * @param content codelab source text
 * @param passMetadata metadata keys to copy into the codelab's extra attributes, may be null
 */
public record CodelabParseRequest(String content, List<String> passMetadata) {}
