package com.questrail.diameter.message;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.dict.Dictionary;
import com.questrail.diameter.dict.StaticDictionary;

/**
 * Message fixtures shared by tests.
 */
public final class TestMessages
{
    public static final long CREDIT_CONTROL_APPLICATION = 4L;
    public static final int CREDIT_CONTROL = 272;

    private TestMessages() {}

    /**
     * Base protocol commands plus Credit-Control ("CC").
     */
    public static Dictionary creditControlDictionary() {
        return StaticDictionary.builder()
                .addAll(StaticDictionary.baseProtocol())
                .addCommand(CREDIT_CONTROL_APPLICATION, CREDIT_CONTROL, "CC")
                .build();
    }

    public static Message request(long applicationId, int commandCode, Dictionary dictionary, byte... payload) {
        DiameterHeader header = DiameterHeader.of(
                DiameterHeader.FLAG_REQUEST, commandCode, applicationId, 0x1111, 0x2222);
        return Message.of(header, payload, dictionary);
    }

    public static Message answer(long applicationId, int commandCode, Dictionary dictionary, byte... payload) {
        DiameterHeader header = DiameterHeader.of(0, commandCode, applicationId, 0x1111, 0x2222);
        return Message.of(header, payload, dictionary);
    }

    public static Message capabilitiesExchangeRequest(byte... payload) {
        return request(StaticDictionary.BASE_APPLICATION, 257, StaticDictionary.baseProtocol(), payload);
    }
}
