package hdlnet.ir;

public enum PortDirection {
  INPUT("input"),
  OUTPUT("output"),
  INOUT("inout");

  private final String serialName;
  PortDirection(String serialName) { this.serialName = serialName; }
  public String getSerialName() { return serialName; }
}
