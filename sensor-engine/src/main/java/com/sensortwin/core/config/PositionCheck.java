package com.sensortwin.core.config;

import java.util.List;

final class PositionCheck {

    private PositionCheck() {
    }

    static boolean isValid(List<? extends Number> coordinates) {
        if (coordinates == null || coordinates.size() != 3) {
            return false;
        }
        for (Number n : coordinates) {
            if (n == null || !Double.isFinite(n.doubleValue())) {
                return false;
            }
        }
        return true;
    }
}
