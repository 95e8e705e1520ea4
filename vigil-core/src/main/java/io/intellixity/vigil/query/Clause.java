package io.intellixity.vigil.query;

public enum Clause { AND, OR }
