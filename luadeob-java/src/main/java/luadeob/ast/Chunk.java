package luadeob.ast;

/** Root of a parsed script: the main chunk's block. */
public record Chunk(Block block) {}
