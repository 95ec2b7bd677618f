package works.bosk.docnode.types;

public record ArrayType(DataType elementType) implements DataType {
	@Override
	public Class<?> rawClass() {
		return elementType.rawClass().arrayType();
	}

	@Override
	public String toString() {
		return elementType + "[]";
	}
}
