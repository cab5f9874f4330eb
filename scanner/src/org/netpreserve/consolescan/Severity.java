package org.netpreserve.consolescan;

public enum Severity {
    ERROR, WARNING, INFO
}
