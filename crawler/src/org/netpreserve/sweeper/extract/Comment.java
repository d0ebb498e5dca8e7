package org.netpreserve.sweeper.extract;

import org.jetbrains.annotations.Nullable;

public record Comment(@Nullable String author, String text, @Nullable Long likes) {
}
