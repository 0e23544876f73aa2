package io.taskrelay.cooldown;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PromptSignatureTest {

    @Test
    void redrawnPromptMapsToSameKey() {
        String first = "╭──────────╮\n│ Do you want to proceed? │\n│ ❯ 1. Yes │\n╰──────────╯";
        String redrawn = "\u001B[1m╭────────────────╮\u001B[0m\n│  Do you want to proceed?  │\n│ ❯ 2. Yes │\n╰────────────────╯";
        Assertions.assertEquals(PromptSignature.key(first), PromptSignature.key(redrawn));
    }

    @Test
    void differentPromptsGetDifferentKeys() {
        Assertions.assertNotEquals(
                PromptSignature.key("Do you want to make this edit to App.java?"),
                PromptSignature.key("Do you want to run npm install?"));
    }

    @Test
    void keyIsThirtyTwoHexChars() {
        String key = PromptSignature.key("Allow network access?");
        Assertions.assertEquals(32, key.length());
        Assertions.assertTrue(key.matches("[0-9a-f]{32}"));
    }

    @Test
    void normalizeStripsNoise() {
        Assertions.assertEquals("allowaccess?", PromptSignature.normalize("\u001B[32m Allow  access 12? \u001B[0m"));
        Assertions.assertEquals("", PromptSignature.normalize(null));
    }
}
