package com.backlogstore.core.codec;

/**
 * A contiguous slice of the body: either the preamble before the first
 * {@code ## } heading, or one heading with everything up to the next one.
 *
 * @param kind    recognized section, {@link SectionKind#OTHER} or {@link SectionKind#PREAMBLE}
 * @param heading heading text without the {@code ## }, {@code null} for the preamble
 * @param raw     exact source text, terminators included
 */
public record BodySpan(SectionKind kind, String heading, String raw) {
}
