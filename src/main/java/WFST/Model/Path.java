package WFST.Model;

import java.util.List;

/**
 * Symbols read and written along an accepting path, with the path weight (final weight included).
 */
public record Path<W>(List<String> input, List<String> output, W weight) {

    public String inputString() {
        return String.join("", input);
    }

    public String outputString() {
        return String.join("", output);
    }

    @Override
    public String toString() {
        return inputString() + ":" + outputString() + "/" + weight;
    }
}
