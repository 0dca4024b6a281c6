package com.sldce.backend.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import com.sldce.backend.exceptions.BadRequestException;

public final class StatsUtils {

    private StatsUtils() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * part / total * 100 with two decimals, 0 when total is 0.
     */
    public static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round(part * 100.0 / total, 2);
    }

    /**
     * Share of reviewed suggestions whose label change was kept, accepted as-is or modified.
     */
    public static double acceptanceRate(long accepted, long modified, long rejected) {
        return percentage(accepted + modified, accepted + modified + rejected);
    }

    /**
     * Applies limit/offset paging to an already ordered list.
     */
    public static <T> List<T> page(List<T> items, int limit, int offset) {
        if (limit <= 0) {
            throw new BadRequestException("limit must be greater than zero, got " + limit);
        }
        if (offset < 0) {
            throw new BadRequestException("offset must not be negative, got " + offset);
        }
        if (offset >= items.size()) {
            return List.of();
        }
        return List.copyOf(items.subList(offset, Math.min(items.size(), offset + limit)));
    }
}
