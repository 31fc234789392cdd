package com.ciro.jprops.resolve;

import java.util.Optional;

public class AliasStrategy implements LookupFallback {

    private final PropertyAliases aliases;

    public AliasStrategy(PropertyAliases aliases) {
        this.aliases = aliases;
    }

    @Override
    public Optional<String> alternateName(String name) {
        return aliases.canonicalFor(name).filter(c -> !c.equalsIgnoreCase(name));
    }
}
