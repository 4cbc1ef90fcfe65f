package org.ontodsl.compiler.frontend.parser.features.comment;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

/**
 * A comment-only statement. The lexer drops {@code #} comments, so the parser never builds
 * this node; it appears only in programs assembled in code. It produces no output.
 *
 * @param text The comment text, without the leading {@code #}.
 * @param source The position of the comment.
 */
public record CommentNode(String text, SourceInfo source) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.COMMENT;
    }

    @Override
    public String subjectAlias() {
        return "";
    }

    @Override
    public SourceInfo sourceInfo() {
        return source;
    }
}
