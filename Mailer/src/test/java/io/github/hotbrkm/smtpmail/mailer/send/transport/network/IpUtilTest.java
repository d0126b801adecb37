package io.github.hotbrkm.smtpmail.mailer.send.transport.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IpUtil behavior verification")
class IpUtilTest {

    @Test
    @DisplayName("IPv4 valid case detection")
    void testIsIpv4Literal_validAddresses() {
        // Given
        String a = "127.0.0.1";
        String b = "0.0.0.0";
        String c = "255.255.255.255";

        // When
        boolean ra = IpUtil.isIpv4Literal(a);
        boolean rb = IpUtil.isIpv4Literal(b);
        boolean rc = IpUtil.isIpv4Literal(c);

        // Then
        assertThat(ra).isTrue();
        assertThat(rb).isTrue();
        assertThat(rc).isTrue();
    }

    @Test
    @DisplayName("IPv4 invalid case detection")
    void testIsIpv4Literal_invalidAddresses() {
        assertThat(IpUtil.isIpv4Literal(null)).isFalse();
        assertThat(IpUtil.isIpv4Literal("")).isFalse();
        assertThat(IpUtil.isIpv4Literal("1.2.3")).isFalse();
        assertThat(IpUtil.isIpv4Literal("1.2.3.4.")).isFalse();
        assertThat(IpUtil.isIpv4Literal("256.1.1.1")).isFalse();
        assertThat(IpUtil.isIpv4Literal("1..2.3")).isFalse();
        assertThat(IpUtil.isIpv4Literal("mx.example.com")).isFalse();
    }

    @Test
    @DisplayName("IPv6 literal detection with and without brackets")
    void testIsIpv6Literal() {
        assertThat(IpUtil.isIpv6Literal("::1")).isTrue();
        assertThat(IpUtil.isIpv6Literal("[2001:db8::1]")).isTrue();
        assertThat(IpUtil.isIpv6Literal("fe80::1%1")).isTrue();
        assertThat(IpUtil.isIpv6Literal("mx.example.com")).isFalse();
        assertThat(IpUtil.isIpv6Literal("")).isFalse();
    }

    @Test
    @DisplayName("Host names are not IP literals")
    void testIsIpLiteral() {
        assertThat(IpUtil.isIpLiteral("10.0.0.1")).isTrue();
        assertThat(IpUtil.isIpLiteral("::1")).isTrue();
        assertThat(IpUtil.isIpLiteral("localhost")).isFalse();
    }
}
