package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

// Seeded synthetic symbol sequences for workloads and property checks.
public class SequenceGenerator {

    private SequenceGenerator() {
    }

    // Symbols drawn uniformly from [0, alphabetSize).
    public static List<Integer> generateUniform(int length, int alphabetSize, long seed) {
        checkArguments(length, alphabetSize);
        RandomGenerator rng = new Well19937c(seed);
        List<Integer> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(rng.nextInt(alphabetSize));
        }
        return out;
    }

    // Symbols in [0, alphabetSize) with Zipf-distributed frequencies; 0 is the most frequent.
    public static List<Integer> generateZipf(int length, int alphabetSize, double exponent, long seed) {
        checkArguments(length, alphabetSize);
        if (exponent <= 0.0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);
        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        List<Integer> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(dist.sample() - 1);
        }
        return out;
    }

    // Characters drawn uniformly from the given alphabet.
    public static String generateUniformString(int length, String alphabet, long seed) {
        if (alphabet == null || alphabet.isEmpty()) {
            throw new IllegalArgumentException("alphabet must not be empty");
        }
        checkArguments(length, alphabet.length());
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet.charAt(rng.nextInt(alphabet.length()));
        }
        return new String(chars);
    }

    private static void checkArguments(int length, int alphabetSize) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        if (alphabetSize <= 0) throw new IllegalArgumentException("alphabetSize must be positive");
    }
}
