package cyk.syntax;

import java.util.BitSet;

/**
 * Bit vector representation of a recognition chart.
 * A set bit <code>A</code> in cell <code>(start, length)</code> means that
 * nonterminal <code>A</code> derives the tokens
 * <code>start .. start+length-1</code>.
 * The chart keeps <code>maxpos*(maxpos+1)</code> cells, the cells of
 * length 0 are never used.
 *
 */
public class BitRecChart {

  public BitRecChart(int maxpos, int maxs) {
    _maxpos = maxpos;
    _maxs = maxs;
    int size = _maxpos * (_maxpos + 1);
    _cells = new BitSet[size];
    for (int i = 0; i < size; i ++)
      _cells[i] = new BitSet(_maxs + 1);
  }

  private final BitSet [] _cells;

  private int index(int start, int length) {
    assert start >= 0 && length >= 1 && start + length <= _maxpos;
    return start * (_maxpos + 1) + length;
  }

  public boolean get(int start, int length, int s) {
    assert s <= _maxs;
    return _cells[index(start, length)].get(s);
  }

  /** @return true if the symbol was not in the cell before */
  public boolean set(int start, int length, int s) {
    assert s <= _maxs;
    BitSet cell = _cells[index(start, length)];
    if (cell.get(s))
      return false;
    cell.set(s);
    return true;
  }

  /** The live cell vector, not a copy */
  public BitSet cell(int start, int length) {
    return _cells[index(start, length)];
  }

  public double fillrate() {
    int filled = 0;
    int used = 0;
    for (int start = 0; start < _maxpos; start ++) {
      for (int length = 1; start + length <= _maxpos; length ++) {
        used ++;
        if (!cell(start, length).isEmpty())
          filled ++;
      }
    }
    return used == 0 ? 0.0 : ((double)filled) / used;
  }

  public boolean recognized(int start) {
    return _maxpos > 0 && start >= 0 && get(0, _maxpos, start);
  }

  /** highest nonterminal id a cell may hold */
  private final int _maxs;
  /** number of tokens */
  private final int _maxpos;

  public int maxpos() {
    return _maxpos;
  }

}
