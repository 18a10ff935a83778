package com.github.sybila.bisim.check;

/**
 * Which of the two compared systems a combined state comes from.
 */
public enum Side {
    LEFT, RIGHT
}
