package com.ciro.jprops.resolve;

import com.ciro.jprops.path.Segment;

import java.util.Optional;

import static com.ciro.jprops.PropertyException.invalidPath;

/** "Slot.ChildOrder": posición de la entidad entre sus hermanos, sin campo detrás. */
public class SiblingOrderStrategy implements ResolutionStrategy {

    public static final String NAME = "ChildOrder";

    @Override
    public Optional<ResolvedTarget> tryResolve(ResolutionContext ctx, Segment segment) {
        if (!ctx.attachmentRoot() || !ctx.isLast() || !NAME.equalsIgnoreCase(segment.name())) {
            return Optional.empty();
        }
        if (segment.hasIndex()) {
            throw invalidPath("'%s' is not a container and cannot be indexed", NAME);
        }
        return Optional.of(ResolvedTarget.synthetic(ctx.entity(), ctx.root(),
                SyntheticKind.SIBLING_ORDER, ctx.path().text()));
    }
}
