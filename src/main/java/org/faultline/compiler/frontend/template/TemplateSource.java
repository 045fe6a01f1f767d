package org.faultline.compiler.frontend.template;

import org.faultline.compiler.api.SourceInfo;

/**
 * The uncompiled text of a message or label template together with the position of its literal.
 *
 * @param text The template text, escapes of the string literal already resolved.
 * @param sourceInfo The position of the literal.
 */
public record TemplateSource(String text, SourceInfo sourceInfo) {}
