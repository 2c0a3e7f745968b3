package com.ryuqq.uuid.testkit.contract;

import java.util.Arrays;
import java.util.List;

/**
 * Well-known UUID values shared by contract tests.
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
public final class UuidFixtures {

    /** Version 4 sample in canonical form. */
    public static final String SAMPLE = "9e472052-a654-4693-9a8b-3ce57ada3d6c";

    /** {@link #SAMPLE} without hyphens. */
    public static final String SAMPLE_HEX = "9e472052a65446939a8b3ce57ada3d6c";

    public static final String NIL = "00000000-0000-0000-0000-000000000000";
    public static final String MAX = "ffffffff-ffff-ffff-ffff-ffffffffffff";

    /** One valid canonical string per version 1 to 5, in version order. */
    public static final List<String> VALID_BY_VERSION = List.of(
        "6ba7b810-9dad-11d1-80b4-00c04fd430c8",
        "000003e8-cbb9-21ea-b201-00155d9b2bde",
        "a3bb189e-8bf9-3888-9912-ace4e6543002",
        SAMPLE,
        "886313e1-3b8a-5372-9b90-0c9aee199e5d"
    );

    /** Strings the strict parser rejects with a format error. */
    public static final List<String> MALFORMED = List.of(
        "not-a-uuid",
        NIL,
        "1ec9414c-232a-6b00-b3c8-9e6bdeced846",
        "9e472052-a654-4693-ca8b-3ce57ada3d6c",
        "9e472052-a654-4693-9a8b-3ce57ada3d6z",
        "9e472052a65446939a8b3ce57ada3d6",
        SAMPLE + "0"
    );

    private UuidFixtures() {
    }

    /**
     * 16 bytes that are structurally fine but carry version 0 and variant 00.
     *
     * @return a fresh array of 0x01 bytes
     */
    public static byte[] arbitraryBytes() {
        byte[] bytes = new byte[16];
        Arrays.fill(bytes, (byte) 0x01);
        return bytes;
    }
}
