/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.parse;

import java.util.Properties;

/**
 * Parser settings.
 *
 * @param tabWidth            0 rejects tabs in indentation, otherwise each tab counts as this many spaces
 * @param strictObjectClosure when true, closing a stream with objects still open is a structural error
 */
public record ParserOptions(int tabWidth, boolean strictObjectClosure) {

    public static final ParserOptions DEFAULTS = new ParserOptions(0, false);

    public ParserOptions {
        if (tabWidth < 0) {
            throw new IllegalArgumentException("Tab width must be >= 0: " + tabWidth);
        }
    }

    public static ParserOptions fromProperties(Properties properties) {
        int tabWidth = Integer.parseInt(properties.getProperty("fdo.parser.tab.width", "0").trim());
        boolean strict = Boolean.parseBoolean(
                properties.getProperty("fdo.parser.strict.object.closure", "false").trim());
        return new ParserOptions(tabWidth, strict);
    }
}
