package com.bko.planner.quality;

public enum Grade {
    A, B, C, D;

    public static Grade fromScore(double overallScore) {
        if (overallScore >= 0.90) {
            return A;
        }
        if (overallScore >= 0.80) {
            return B;
        }
        if (overallScore >= 0.70) {
            return C;
        }
        return D;
    }
}
