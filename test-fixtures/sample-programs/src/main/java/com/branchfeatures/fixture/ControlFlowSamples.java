package com.branchfeatures.fixture;

/**
 * Methods covering the control-flow shapes the analyses care about:
 * straight-line code, nested loops, switches, reference comparisons and exception handlers.
 */
public class ControlFlowSamples {

    private static int counter;

    public static int straightLine(int a, int b) {
        int sum = a + b;
        int scaled = sum * 3;
        return scaled - 1;
    }

    public static int nestedLoops(int rows, int cols) {
        int total = 0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                total += i * j;
            }
        }
        return total;
    }

    public static String classify(int code) {
        switch (code) {
            case 1:
                return "one";
            case 2:
                return "two";
            case 7:
                return "seven";
            default:
                return "other";
        }
    }

    public static boolean sameOrNull(Object a, Object b) {
        if (a == null) {
            return b == null;
        }
        return a == b;
    }

    public static int parseOrDefault(String text, int fallback) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static int bump(double scale) {
        counter += 2;
        return (int) (counter * scale * 1.5);
    }
}
