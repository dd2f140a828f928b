package com.assoverlay.models;

public enum FontWeight {
    NORMAL,
    BOLD
}
