package com.example.trafficservice.schema;

import com.fasterxml.jackson.databind.node.TextNode;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Opaque blob schemas. Text bodies keep a truncated example, binary ones none.
 */
final class OpaqueBodies {

    static final int MAX_EXAMPLE_LENGTH = 512;

    private OpaqueBodies() {
    }

    static SchemaNode of(byte[] body, String mediaType) {
        String format = mediaType == null || mediaType.isEmpty() ? "application/octet-stream" : mediaType;
        String text = decodeText(body);
        if (text == null) {
            return SchemaNode.opaque(format, null);
        }
        if (text.length() > MAX_EXAMPLE_LENGTH) {
            text = text.substring(0, MAX_EXAMPLE_LENGTH);
        }
        return SchemaNode.opaque(format, TextNode.valueOf(text));
    }

    private static String decodeText(byte[] body) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
