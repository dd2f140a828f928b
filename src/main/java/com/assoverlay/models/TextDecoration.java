package com.assoverlay.models;

public enum TextDecoration {
    NONE,
    UNDERLINE
}
