package com.easytidal.mirror.layout;

public record Point(double x, double y) {}
