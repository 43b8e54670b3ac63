package com.gymledger.backend.modules.member.domain;

import java.util.Locale;
import java.util.regex.Pattern;

public final class MemberCodeFormatter {

    public static final String PREFIX = "MBR-";
    private static final Pattern CODE_PATTERN = Pattern.compile("^MBR-[0-9]{4,}$");

    private MemberCodeFormatter() {
    }

    /**
     * Zero-pads to four digits; larger numbers simply grow wider.
     */
    public static String toMemberCode(long memberNumber) {
        if (memberNumber <= 0) {
            throw new IllegalArgumentException("memberNumber must be positive");
        }
        return PREFIX + String.format(Locale.ROOT, "%04d", memberNumber);
    }

    public static boolean isValid(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }
}
