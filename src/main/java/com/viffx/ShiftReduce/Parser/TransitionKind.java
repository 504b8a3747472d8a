package com.viffx.ShiftReduce.Parser;

public enum TransitionKind {
    SHIFT,
    REDUCE,
    LEFT_ARC,
    RIGHT_ARC,
}
