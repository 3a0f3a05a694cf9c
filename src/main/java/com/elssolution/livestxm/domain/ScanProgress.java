package com.elssolution.livestxm.domain;

/** Frames accepted so far against the declared total. */
public record ScanProgress(int accepted, int total) {

    public static final ScanProgress NONE = new ScanProgress(0, 0);

    public int percent() {
        return total <= 0 ? 0 : (int) Math.floor(100.0 * accepted / total);
    }

    public boolean complete() {
        return total > 0 && accepted >= total;
    }

    /** Same shape as the progress bar text: "[12/100] (12%)". */
    public String label() {
        String core = "[" + accepted + "/" + total + "] (" + percent() + "%)";
        return complete() ? "Scan Complete! " + core : core;
    }
}
