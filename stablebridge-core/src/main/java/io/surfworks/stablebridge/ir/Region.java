package io.surfworks.stablebridge.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of blocks owned by a single operation.
 *
 * <p>Regions are never shared or cloned. Moving code between operations goes
 * through {@link #takeBlocks(Region)}, which transfers the block objects.
 */
public final class Region {

    private final List<Block> blocks = new ArrayList<>();
    private final Operation parent;

    Region(Operation parent) {
        this.parent = parent;
    }

    public Operation parentOp() {
        return parent;
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public Block front() {
        return blocks.get(0);
    }

    /**
     * Appends a block that does not belong to any region yet.
     */
    public Block append(Block block) {
        if (block.parentRegion() != null) {
            throw new IllegalStateException("Block already belongs to a region");
        }
        blocks.add(block);
        block.setParentRegion(this);
        return block;
    }

    /**
     * Moves every block of {@code source} to the end of this region.
     *
     * <p>The blocks keep their identity, arguments and operations; only their
     * parent changes. {@code source} is left empty.
     */
    public void takeBlocks(Region source) {
        if (source == this) {
            return;
        }
        for (Block block : source.blocks) {
            blocks.add(block);
            block.setParentRegion(this);
        }
        source.blocks.clear();
    }
}
