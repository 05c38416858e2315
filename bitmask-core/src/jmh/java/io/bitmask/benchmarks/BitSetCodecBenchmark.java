package io.bitmask.benchmarks;

import io.bitmask.kernel.BitSetCodec;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.Random;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BitSetCodecBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        private int[] ids;
        private long sparseMask;
        private long denseMask;

        @Setup(Level.Trial)
        public void setUp() {
            var random = new Random(42);
            ids = random.ints(32, 0, 64).toArray();
            sparseMask = BitSetCodec.encode(1, 17, 40, 63);
            denseMask = random.nextLong() | Long.MIN_VALUE;
        }
    }

    @Benchmark
    public long encode(BenchmarkState state) {
        return BitSetCodec.encode(state.ids);
    }

    @Benchmark
    public int[] decodeSparse(BenchmarkState state) {
        return BitSetCodec.decode(state.sparseMask);
    }

    @Benchmark
    public int[] decodeDense(BenchmarkState state) {
        return BitSetCodec.decode(state.denseMask);
    }

    @Benchmark
    public boolean hasBit(BenchmarkState state) {
        return BitSetCodec.hasBit(state.denseMask, 40);
    }

    @Benchmark
    public long toggleBit(BenchmarkState state) {
        return BitSetCodec.toggleBit(state.denseMask, 40);
    }
}
