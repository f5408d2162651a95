package works.quill.document;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextRangeTest {

	@Test
	void invalidBounds_rejected() {
		assertThrows(IllegalArgumentException.class, () -> TextRange.of(-1, 2));
		assertThrows(IllegalArgumentException.class, () -> TextRange.of(3, 2));
	}

	@Test
	void emptyRange_allowed() {
		TextRange empty = TextRange.of(4, 4);
		assertTrue(empty.isEmpty());
		assertEquals(0, empty.length());
		assertEquals("", empty.of("abcdef"));
	}

	@Test
	void crosses_onlyForPartialOverlap() {
		TextRange range = TextRange.of(2, 6);
		assertTrue(range.crosses(TextRange.of(4, 8)));
		assertTrue(range.crosses(TextRange.of(0, 3)));
		assertFalse(range.crosses(TextRange.of(3, 5)), "Enclosed");
		assertFalse(range.crosses(TextRange.of(0, 10)), "Enclosing");
		assertFalse(range.crosses(TextRange.of(6, 9)), "Adjacent");
		assertFalse(range.crosses(range), "Identical");
	}

	@Test
	void encloses_isNonStrict() {
		TextRange range = TextRange.of(2, 6);
		assertTrue(range.encloses(range));
		assertTrue(range.encloses(TextRange.of(2, 2)));
		assertFalse(range.encloses(TextRange.of(1, 6)));
	}

	@Test
	void clampedTo_fitsText() {
		assertEquals(TextRange.of(2, 5), TextRange.of(2, 9).clampedTo(5));
		assertEquals(TextRange.of(5, 5), TextRange.of(7, 9).clampedTo(5));
		assertEquals(TextRange.of(1, 3), TextRange.of(1, 3).clampedTo(5));
	}

	@Test
	void union_coversBoth() {
		assertEquals(TextRange.of(1, 8), TextRange.of(4, 8).union(TextRange.of(1, 5)));
	}
}
