package dev.fathom.literal;

/**
 * Position of the pattern inside a matched line.
 *
 * @param start byte offset of the first matched byte within the line
 * @param end byte offset one past the last matched byte
 * @param text the matched text
 */
public record Submatch(int start, int end, String text) {}
