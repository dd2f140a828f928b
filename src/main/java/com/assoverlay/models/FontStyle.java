package com.assoverlay.models;

public enum FontStyle {
    NORMAL,
    ITALIC
}
