package com.assoverlay.models;

public enum TextAlign {
    LEFT,
    CENTER,
    RIGHT
}
