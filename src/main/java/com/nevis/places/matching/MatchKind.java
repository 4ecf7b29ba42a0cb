package com.nevis.places.matching;

public enum MatchKind {
    NAME_PREFIX,
    NAME_WORD,
    ALIAS_PREFIX,
    ALIAS_WORD
}
