// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.hwaddr.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import sh.hwaddr.core.types.MacAddress;

/**
 * JMH benchmark for MAC address parsing and classification.
 *
 * <p>Measures throughput (ops/sec) for:
 * <ul>
 *   <li>{@code parse} - validating and normalizing one notation</li>
 *   <li>{@code classify} - every predicate on an already-parsed address</li>
 *   <li>{@code classifyBitmask} - the same predicates computed from the first octet directly</li>
 * </ul>
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class MacAddressBenchmark {

    @Param({ "a0b1c2d3e4f5", "a0-b1-c2-d3-e4-f5", "A0:B1:C2:D3:E4:F5", "a0b1.c2d3.e4f5" })
    private String text;

    private MacAddress mac;

    @Setup
    public void setup() {
        mac = new MacAddress(text);
    }

    @Benchmark
    public MacAddress parse() {
        return new MacAddress(text);
    }

    @Benchmark
    public void classify(Blackhole bh) {
        bh.consume(mac.kind());
        bh.consume(mac.isBroadcast());
        bh.consume(mac.isMulticast());
        bh.consume(mac.isUaa());
        bh.consume(mac.isLaa());
    }

    @Benchmark
    public void classifyBitmask(Blackhole bh) {
        final int octet = mac.toBytes()[0] & 0xFF;
        bh.consume((octet & 0x03) == 0);
        bh.consume((octet & 0x0F) == 0x0A);
        bh.consume((octet & 0x01) != 0);
        bh.consume((octet & 0x03) == 0x02);
    }

    @Benchmark
    public String toBinaryRepresentation() {
        return mac.toBinaryRepresentation();
    }
}
