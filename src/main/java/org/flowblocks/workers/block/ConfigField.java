package org.flowblocks.workers.block;

/**
 * Describes one operator facing configuration setting of a block.
 *
 */
public class ConfigField {

	public enum Type {
		STRING, NUMBER
	}

	private final String key;
	private final String name;
	private final String description;
	private final Type type;
	private final boolean required;
	private final Object defaultValue;

	public ConfigField(String key, String name, String description, Type type, boolean required,
			Object defaultValue) {
		this.key = key;
		this.name = name;
		this.description = description;
		this.type = type;
		this.required = required;
		this.defaultValue = defaultValue;
	}

	public String getKey() {
		return key;
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	public Type getType() {
		return type;
	}

	public boolean isRequired() {
		return required;
	}

	/**
	 * @return The default value or null when there is none.
	 */
	public Object getDefaultValue() {
		return defaultValue;
	}

	@Override
	public String toString() {
		return "ConfigField [key=" + key + ", type=" + type + ", required=" + required + "]";
	}
}
