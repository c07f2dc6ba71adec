package io.flowrules.core.rule;

/**
 * A lexical token.
 *
 * @param type     token kind
 * @param text     source text; keywords are lowercased, strings keep their quotes
 * @param position zero-based offset in the scanned text
 */
public record Token(TokenType type, String text, int position) {}
