package com.flowo.live.core.upstream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.BDDAssertions.then;

class CredentialMaskTest {

    @Test
    void givenIdentifiers_whenMasked_thenOnlyEndsVisible() {
        then(CredentialMask.mask("admin")).isEqualTo("a***n");
        then(CredentialMask.mask("ab")).isEqualTo("**");
        then(CredentialMask.mask(" ")).isEmpty();
        then(CredentialMask.mask(null)).isEmpty();
    }
}
