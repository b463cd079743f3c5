package io.evitadb.anchorpatch.tool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperationType should resolve wire names")
public class OperationTypeTest {

	@Test
	@DisplayName("resolves wire names")
	void shouldResolveWireNames() {
		assertEquals(OperationType.CREATE_FILE, OperationType.fromWireName("create_file"));
		assertEquals(OperationType.UPDATE_FILE, OperationType.fromWireName("update_file"));
		assertEquals(OperationType.DELETE_FILE, OperationType.fromWireName("delete_file"));
	}

	@Test
	@DisplayName("ignores case, dashes and surrounding whitespace")
	void shouldResolveLeniently() {
		assertEquals(OperationType.UPDATE_FILE, OperationType.fromWireName(" UPDATE_FILE "));
		assertEquals(OperationType.CREATE_FILE, OperationType.fromWireName("create-file"));
	}

	@Test
	@DisplayName("rejects unknown operation types")
	void shouldRejectUnknown() {
		final IllegalArgumentException exception = assertThrows(
			IllegalArgumentException.class,
			() -> OperationType.fromWireName("rename_file")
		);

		assertTrue(exception.getMessage().contains("rename_file"));
	}
}
