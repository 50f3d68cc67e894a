package com.exprgraph.parse;

/** Why a piece of expression text could not be compiled. */
public enum ParseErrorKind {
    /** The text contains no tokens at all. */
    EMPTY_INPUT,
    /** A token (or the end of input) does not fit any grammar position. */
    UNEXPECTED_TOKEN,
    /** A '(' reached the end of input without its matching ')'. */
    UNCLOSED_PAREN,
    /** A complete expression was parsed but input remains. */
    TRAILING_INPUT
}
