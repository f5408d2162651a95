package works.quill.document;

import java.util.Set;

/**
 * Which elements the parser treats as passages and as speech.
 *
 * @param blockElements elements whose text becomes a {@link Passage}
 * @param speechElements tag types from which {@link DialogueSpan}s are derived
 * @param skippedSections elements whose subtrees never contain passages
 * @param speakerAttribute attribute of a speech tag naming who speaks
 * @param addresseeAttribute attribute of a speech tag naming who is spoken to
 */
public record ParserConfiguration(
	Set<String> blockElements,
	Set<String> speechElements,
	Set<String> skippedSections,
	String speakerAttribute,
	String addresseeAttribute
) {
	public ParserConfiguration {
		blockElements = Set.copyOf(blockElements);
		speechElements = Set.copyOf(speechElements);
		skippedSections = Set.copyOf(skippedSections);
	}

	public static ParserConfiguration defaultConfiguration() {
		return new ParserConfiguration(
			Set.of("p", "ab", "l", "head"),
			Set.of("said"),
			Set.of("teiHeader", "standOff"),
			"who",
			"toWhom");
	}

	public ParserConfiguration withSpeechElements(Set<String> newSpeechElements) {
		return new ParserConfiguration(blockElements, newSpeechElements, skippedSections, speakerAttribute, addresseeAttribute);
	}
}
