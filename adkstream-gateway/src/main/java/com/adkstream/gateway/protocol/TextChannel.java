package com.adkstream.gateway.protocol;

/**
 * Text streams that form blocks within a turn. The block id depends only on
 * the turn's message id and the channel.
 */
public enum TextChannel {
    /** Model answer text, including transcription of spoken output. */
    OUTPUT("output_text"),
    /** Transcription of the user's spoken input. */
    INPUT_TRANSCRIPT("input_text");

    private final String discriminator;

    TextChannel(String discriminator) {
        this.discriminator = discriminator;
    }

    public String blockId(String messageId) {
        return messageId + "_" + discriminator;
    }
}
