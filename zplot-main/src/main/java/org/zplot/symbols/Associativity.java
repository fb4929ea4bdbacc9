package org.zplot.symbols;

public enum Associativity {
    LEFT,
    RIGHT
}
