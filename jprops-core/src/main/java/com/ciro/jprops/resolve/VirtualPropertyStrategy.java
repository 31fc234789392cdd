package com.ciro.jprops.resolve;

import com.ciro.jprops.path.Segment;
import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.VirtualProperty;

import java.util.Optional;

import static com.ciro.jprops.PropertyException.invalidPath;

/** Propiedades de slot que no son campos: "Slot.Position", "Slot.HorizontalAlignment"... */
public class VirtualPropertyStrategy implements ResolutionStrategy {

    private final AttachmentFamilyProvider families;

    public VirtualPropertyStrategy(AttachmentFamilyProvider families) {
        this.families = families;
    }

    @Override
    public Optional<ResolvedTarget> tryResolve(ResolutionContext ctx, Segment segment) {
        if (!ctx.attachmentRoot() || !ctx.isFirst()) return Optional.empty();

        Optional<VirtualProperty> vp = families.findVirtual(ctx.root(), segment.name());
        if (vp.isEmpty()) return Optional.empty();

        if (segment.hasIndex() || !ctx.isLast()) {
            throw invalidPath("Virtual property '%s' of %s cannot be traversed or indexed",
                    vp.get().name(), families.familyName(ctx.root()));
        }
        return Optional.of(ResolvedTarget.virtual(ctx.entity(), ctx.root(), vp.get(), ctx.path().text()));
    }
}
