package com.dendrol.codec;

import com.dendrol.Dendrol;
import com.dendrol.tree.PatternTree;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class RoundTripTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "[ipv4-addr:value = '1.2.3.4']",
        "[file:name NOT = 'test.exe' AND (file:size < 4 OR file:size > 4096)]",
        "[file:hashes.'SHA-256' = 'aec070645fe53ee3b3763059376134f058cc337247c978add178b6ccdfb0019f']",
        "[file:extensions.'windows-pebinary-ext'.sections[*].entropy > 7.0]",
        "[network-traffic:protocols[0] = 'tcp' AND network-traffic:dst_port >= 443]",
        "[a:b[-1] = 1] AND [a:c[*].d[2] = 2]",
        "[ipv4-addr:value = '198.51.100.1/32' OR ipv6-addr:value = '::1'] FOLLOWEDBY [domain-name:value = 'example.com']",
        "([a:b = 1] OR [c:d = 2]) AND [e:f = 3] WITHIN 600 SECONDS",
        "[a:b = 1] REPEATS 5 TIMES WITHIN 1800 SECONDS",
        "[a:b = 1] START t'2017-06-29T00:00:00Z' STOP t'2017-12-05T00:00:00.123Z'",
        "[a:b = 1] WITHIN 0 SECONDS",
        "[user-account:is_privileged = true AND user-account:is_disabled = false]",
        "[a:b = -12 OR a:b = 3.14159 OR a:b = -0.5]",
        "[a:b = t'2020-01-01T12:30:45Z']",
        "[file:payload_bin = b'aGVsbG8gd29ybGQ=']",
        "[file:payload_bin = h'00ff10']",
        "[file:name MATCHES '^Final Report.+[.]exe$']",
        "[file:name LIKE '%report%' AND file:name NOT LIKE 'draft%']",
        "[process:command_line = 'cmd.exe /c \"echo hi\"']",
        "[a:b = '' OR a:b = ' ' OR a:b = 'true' OR a:b = '42' OR a:b = 'null' OR a:b = '~']",
        "[a:b = '- item' OR a:b = '? key' OR a:b = 'key: value' OR a:b = 'x #y' OR a:b = '{a, b}']",
        "[a:b = 'it\\'s' OR a:b = 'C:\\\\Windows']",
        "[a:b = 'line\u2028sep' OR a:b = 'caf\u00e9' OR a:b = '\u65e5\u672c']",
        "[a:b = '2017-06-29T00:00:00Z' OR a:b = '2017-06-29' OR a:b = 'yes']",
        "[a:b ISSUBSET '198.51.100.0/24' AND a:c ISSUPERSET '198.51.100.0/24']",
        "[a:b != 1 AND a:b <= 2 AND a:b NOT > 3]",
        "(([a:b = 1] AND [a:c = 2]) OR ([a:d = 3] FOLLOWEDBY [a:e = 4])) REPEATS 2 TIMES",
        "[x:'odd property'.'with.dots'[3] = 'v']",
        "[a:b = 12345678.0 OR a:b = 0.00001 OR a:b = 1.5]",
        "[a:b = '[*]' OR a:b = 'a [*] b' OR a:b = '*x' OR a:b = '&x' OR a:b = '!x' OR a:b = '|' OR a:b = '>']",
        "[a:b = 'on' OR a:b = 'No' OR a:b = '0x1F' OR a:b = '1_000' OR a:b = '.inf' OR a:b = '---']",
        "[a:'[*]'[*] = 1]",
        "[a:b = 'a, [*]' OR a:b = 'a, \\'b' OR a:b = 'x {\"y' OR a:b = 'it\\'s [2]']",
    })
    public void testRoundTrip(String pattern) {
        PatternTree tree = Dendrol.parsePattern(pattern);
        String text = Dendrol.encode(tree);

        PatternTree decoded = Dendrol.decode(text);
        assertEquals(tree, decoded, text);
        assertEquals(text, Dendrol.encode(decoded));
    }
}
