package WFST.Model;

/**
 * Arc as seen by serialization and visualization collaborators.
 * output is null for plain automata; epsilon is the empty string.
 */
public record ExportedTransition<W>(int source, String input, String output, int target, W weight) {
}
