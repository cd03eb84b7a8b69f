package com.raditha.syntax.semantic;

import com.raditha.syntax.token.SourceLocation;

import java.util.List;

/**
 * A {@code template <...>} header.
 *
 * @param templateLoc the {@code template} keyword
 * @param lAngle      opening angle bracket
 * @param parameters  template parameters, in order
 * @param rAngle      closing angle bracket
 */
public record TemplateParameterList(
        SourceLocation templateLoc,
        SourceLocation lAngle,
        List<Decl> parameters,
        SourceLocation rAngle) {

    public TemplateParameterList {
        if (templateLoc == null || templateLoc.isInvalid()) {
            throw new IllegalArgumentException("template parameter list needs a template keyword");
        }
        lAngle = SourceLocation.orInvalid(lAngle);
        rAngle = SourceLocation.orInvalid(rAngle);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
