package net.jrector.api;

import java.util.Comparator;

public record Replacement(SourceSpan span, String newText) {

    public static final Comparator<Replacement> COMPARATOR = Comparator
            .<Replacement>comparingInt(replacement -> replacement.span.start())
            .thenComparingInt(replacement -> replacement.span.end());
}
