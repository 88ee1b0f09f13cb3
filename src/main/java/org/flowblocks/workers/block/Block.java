package org.flowblocks.workers.block;

import java.util.List;

import org.flowblocks.workers.lifecycle.BlockHealth;

/**
 * A building block hosted by the automation runtime. The runtime calls the
 * lifecycle hooks and the trigger handler; it never runs two of them at the
 * same time for one block instance.
 *
 */
public interface Block {

	BlockKind getKind();

	/**
	 * The settings an operator can configure for this block.
	 * 
	 * @return
	 */
	List<ConfigField> getConfigFields();

	/**
	 * Called on activation and whenever the runtime asks the block to
	 * re-validate itself.
	 * 
	 * @return The resulting health.
	 */
	BlockHealth onSync();

	/**
	 * Called when the block is removed.
	 * 
	 * @return The resulting health.
	 */
	BlockHealth onDrain();

	/**
	 * Handle a trigger: an input event or a scheduled tick, depending on the
	 * kind of block.
	 */
	void onTrigger();
}
