package works.quill.markup;

import static java.util.Objects.requireNonNull;

public record Text(String value) implements Node {
	public Text {
		requireNonNull(value);
	}

	@Override
	public String textContent() {
		return value;
	}

	public boolean isBlank() {
		return value.isBlank();
	}
}
