package com.example.MedifBot.intent;

/**
 * Canned answer for a social message.
 *
 * @param text     reply shown to the user
 * @param greeting true when the message itself was a bare greeting
 */
public record SocialReply(String text, boolean greeting) {
}
