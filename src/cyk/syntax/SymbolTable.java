package cyk.syntax;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Dense numbering of grammar symbols, used as bit positions in chart cells.
 * Ids start at 0 and follow registration order.
 *
 */
public class SymbolTable implements Serializable {

  private static final long serialVersionUID = 1L;

  /** @return the id of <code>symbol</code>, registering it if new */
  public int register(String symbol) {
    Integer id = _ids.get(symbol);
    if (id != null)
      return id;
    _ids.put(symbol, _symbols.size());
    _symbols.add(symbol);
    return _symbols.size() - 1;
  }

  /** @return the id of <code>symbol</code>, -1 if unknown */
  public int lookup(String symbol) {
    Integer id = _ids.get(symbol);
    return id == null ? -1 : id;
  }

  /** @return the symbol numbered <code>id</code>, null if out of range */
  public String lookup(int id) {
    if (id < 0 || id >= _symbols.size())
      return null;
    return _symbols.get(id);
  }

  public int size() {
    return _symbols.size();
  }

  private final HashMap<String,Integer> _ids = new HashMap<String,Integer>();
  private final List<String> _symbols = new ArrayList<String>();

}
