package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Represents a parsed update patch as the ordered list of its sections.
 *
 * @param sections the sections in patch order
 */
public record ParsedDiff(
	@Nonnull List<Section> sections
) {

	public ParsedDiff {
		Objects.requireNonNull(sections, "sections must not be null");
		sections = List.copyOf(sections);
	}

	/**
	 * Returns the total number of lines added across all sections.
	 *
	 * @return total lines added
	 */
	public int linesAdded() {
		return this.sections.stream()
			.mapToInt(section -> section.insertLines().size())
			.sum();
	}

	/**
	 * Returns the total number of lines removed across all sections.
	 *
	 * @return total lines removed
	 */
	public int linesRemoved() {
		return this.sections.stream()
			.mapToInt(section -> section.deleteLines().size())
			.sum();
	}

	public int sectionCount() {
		return this.sections.size();
	}
}
